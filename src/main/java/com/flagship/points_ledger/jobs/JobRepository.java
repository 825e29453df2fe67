package com.flagship.points_ledger.jobs;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for the job queue.
 *
 * Status changes are native updates rather than entity writes: the worker
 * rolls handler savepoints back, and a rollback to savepoint clears the
 * persistence context, so managed state cannot be relied upon after it.
 *
 * Every update after the claim is guarded by {@code attempts}, which the
 * claim increments, so a worker whose lease expired cannot overwrite the
 * outcome of the worker that reclaimed the job.
 */
@Repository
public interface JobRepository extends JpaRepository<JobEntity, Long> {

    /**
     * Claims the oldest due job: a pending job whose run time has come, or a
     * processing job whose lease ran out.
     *
     * SKIP LOCKED makes concurrent workers pass over a row another worker is
     * claiming instead of waiting for it. The claim itself is the committed
     * PROCESSING status and lease written by {@link #markProcessing}.
     */
    @Query(value = """
            SELECT * FROM jobs
            WHERE (status = 'PENDING' AND run_at <= NOW())
               OR (status = 'PROCESSING' AND locked_until < NOW())
            ORDER BY run_at ASC, id ASC
            LIMIT 1
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    Optional<JobEntity> claimNextDueJob();

    @Modifying
    @Query(value = """
            UPDATE jobs
            SET attempts = attempts + 1,
                status = 'PROCESSING',
                locked_until = NOW() + CAST(:leaseMs AS double precision) * INTERVAL '1 millisecond',
                updated_at = NOW()
            WHERE id = :id
            """, nativeQuery = true)
    int markProcessing(@Param("id") long id, @Param("leaseMs") long leaseMs);

    /**
     * Records a final status for the claim identified by {@code attempts}.
     * Returns 0 if the claim was lost to another worker after its lease expired.
     */
    @Modifying
    @Query(value = """
            UPDATE jobs
            SET status = :status, last_error = :lastError, locked_until = NULL, updated_at = NOW()
            WHERE id = :id AND status = 'PROCESSING' AND attempts = :attempts
            """, nativeQuery = true)
    int finish(@Param("id") long id,
               @Param("attempts") int attempts,
               @Param("status") String status,
               @Param("lastError") String lastError);

    /**
     * Puts a failed attempt back in the queue, due after {@code delayMs}.
     * Guarded by the claim like {@link #finish}.
     */
    @Modifying
    @Query(value = """
            UPDATE jobs
            SET status = 'PENDING',
                last_error = :lastError,
                locked_until = NULL,
                run_at = NOW() + CAST(:delayMs AS double precision) * INTERVAL '1 millisecond',
                updated_at = NOW()
            WHERE id = :id AND status = 'PROCESSING' AND attempts = :attempts
            """, nativeQuery = true)
    int reschedule(@Param("id") long id,
                   @Param("attempts") int attempts,
                   @Param("lastError") String lastError,
                   @Param("delayMs") long delayMs);

    long countByStatus(JobStatus status);

    @Query("SELECT COUNT(j) FROM JobEntity j WHERE j.status = :status AND j.runAt <= :now")
    long countDue(@Param("status") JobStatus status, @Param("now") Instant now);

    /**
     * Run time of the longest-waiting due job, for lag monitoring.
     */
    @Query("SELECT MIN(j.runAt) FROM JobEntity j WHERE j.status = :status AND j.runAt <= :now")
    Optional<Instant> findOldestDueRunAt(@Param("status") JobStatus status, @Param("now") Instant now);

    @Query(value = "SELECT COUNT(*) FROM jobs_stuck", nativeQuery = true)
    long countStuck();
}
