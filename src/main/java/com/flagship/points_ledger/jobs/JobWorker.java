package com.flagship.points_ledger.jobs;

import com.flagship.points_ledger.config.TransactionConfig;
import com.flagship.points_ledger.observability.CorrelationContext;
import com.flagship.points_ledger.observability.JobMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Claims and executes jobs.
 *
 * One iteration:
 * 1. Claim the oldest due job with FOR UPDATE SKIP LOCKED, increment its
 *    attempt count and mark it PROCESSING with a lease, then commit
 * 2. Run the registered handler inside a savepoint of a second transaction
 * 3. Record COMPLETED in that transaction, or on failure roll the savepoint
 *    back and record PENDING (with backoff) or FAILED
 *
 * The handler's writes and the job's outcome commit together. The attempt
 * is committed before the handler starts, so a worker that dies or hangs
 * still uses up an attempt: once the lease runs out the job is claimed again,
 * and a job whose attempts are exhausted that way is failed without running.
 *
 * The handler transaction carries a timeout. When that transaction can no
 * longer be used (timed out, connection lost) the failure is recorded in a
 * fresh transaction instead.
 */
@Component
@Slf4j
public class JobWorker {

    private static final int MAX_ERROR_LENGTH = 500;

    private final JobRepository jobRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final JobMetrics jobMetrics;
    private final TransactionTemplate bookkeepingTransactionTemplate;
    private final TransactionTemplate workerTransactionTemplate;
    private final TransactionTemplate nestedTransactionTemplate;
    private final String workerName;
    private final int maxAttempts;
    private final long leaseMs;
    private final long baseBackoffMs;
    private final long maxBackoffMs;

    public JobWorker(JobRepository jobRepository,
                     JobHandlerRegistry handlerRegistry,
                     JobMetrics jobMetrics,
                     PlatformTransactionManager transactionManager,
                     @Qualifier(TransactionConfig.NESTED_TRANSACTION_TEMPLATE) TransactionTemplate nestedTransactionTemplate,
                     @Value("${jobs.worker.name:points-worker}") String workerName,
                     @Value("${jobs.worker.max-attempts:8}") int maxAttempts,
                     @Value("${jobs.worker.transaction-timeout-seconds:60}") int transactionTimeoutSeconds,
                     @Value("${jobs.worker.lease-seconds:120}") int leaseSeconds,
                     @Value("${jobs.retry.base-backoff-ms:1000}") long baseBackoffMs,
                     @Value("${jobs.retry.max-backoff-ms:60000}") long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("jobs.worker.max-attempts must be at least 1");
        }
        if (leaseSeconds <= transactionTimeoutSeconds) {
            throw new IllegalArgumentException(
                    "jobs.worker.lease-seconds must be longer than jobs.worker.transaction-timeout-seconds");
        }
        this.jobRepository = jobRepository;
        this.handlerRegistry = handlerRegistry;
        this.jobMetrics = jobMetrics;
        this.nestedTransactionTemplate = nestedTransactionTemplate;
        this.workerName = workerName;
        this.maxAttempts = maxAttempts;
        this.leaseMs = leaseSeconds * 1000L;
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);

        this.bookkeepingTransactionTemplate = new TransactionTemplate(transactionManager);
        this.bookkeepingTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.workerTransactionTemplate = new TransactionTemplate(transactionManager);
        this.workerTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.workerTransactionTemplate.setTimeout(transactionTimeoutSeconds);
    }

    /**
     * Processes at most one due job.
     *
     * @return what happened to the claimed job, or empty if no job was due
     */
    public Optional<JobOutcome> processNextJob() {
        Optional<Job> claimed = claim();
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        Job job = claimed.get();
        long startedAt = System.nanoTime();

        try (CorrelationContext.Scope jobScope = CorrelationContext.with(CorrelationContext.JOB_ID_MDC_KEY, job.getId());
             CorrelationContext.Scope correlationScope = CorrelationContext.ensureCorrelationId()) {

            if (job.getAttempts() > maxAttempts) {
                return Optional.of(failExhaustedLease(job, startedAt));
            }

            try {
                return Optional.ofNullable(workerTransactionTemplate.execute(status -> process(job, status, startedAt)));
            } catch (RuntimeException e) {
                log.warn("Job transaction aborted, recording failure separately: id={}, type={}, error={}",
                        job.getId(), job.getType(), e.getMessage());
                Optional<JobHandler> handler = handlerRegistry.find(job.getType());
                return Optional.ofNullable(bookkeepingTransactionTemplate.execute(status ->
                        recordFailure(job, handler.orElse(null), e, startedAt)));
            }
        }
    }

    /**
     * Processes due jobs until none is left or {@code limit} jobs were handled.
     *
     * @return the number of jobs processed
     */
    public int drainDueJobs(int limit) {
        int processed = 0;
        while (processed < limit && processNextJob().isPresent()) {
            processed++;
        }
        if (processed > 0) {
            log.debug("[{}] processed {} job(s)", workerName, processed);
        }
        return processed;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private Optional<Job> claim() {
        return bookkeepingTransactionTemplate.execute(status ->
                jobRepository.claimNextDueJob()
                        .map(JobEntity::toDomain)
                        .map(job -> {
                            if (job.getStatus() == JobStatus.PROCESSING) {
                                log.warn("Reclaiming job with expired lease: id={}, type={}, attempts={}",
                                        job.getId(), job.getType(), job.getAttempts());
                            }
                            jobRepository.markProcessing(job.getId(), leaseMs);
                            return job.withAttempts(job.getAttempts() + 1).withStatus(JobStatus.PROCESSING);
                        }));
    }

    private JobOutcome failExhaustedLease(Job job, long startedAt) {
        String message = "lease expired on the last allowed attempt";
        bookkeepingTransactionTemplate.executeWithoutResult(status ->
                jobRepository.finish(job.getId(), job.getAttempts(), JobStatus.FAILED.name(), message));
        log.error("Job failed without running, attempts exhausted by expired leases: id={}, type={}, attempts={}",
                job.getId(), job.getType(), job.getAttempts());
        return finish(job, JobOutcome.Disposition.FAILED, message, startedAt);
    }

    private JobOutcome process(Job job, TransactionStatus status, long startedAt) {
        Optional<JobHandler> handler = handlerRegistry.find(job.getType());
        if (handler.isEmpty()) {
            // An older worker must not jam the queue on a type only newer code knows.
            log.warn("No handler registered for job type, marking completed: id={}, type={}",
                    job.getId(), job.getType());
            return finishOrLose(job, status, JobStatus.COMPLETED,
                    "no handler registered for type " + job.getType(),
                    JobOutcome.Disposition.SKIPPED_UNKNOWN_TYPE, startedAt);
        }

        try {
            nestedTransactionTemplate.executeWithoutResult(s -> handler.get().handle(job));
        } catch (RuntimeException e) {
            return recordFailure(job, handler.get(), e, startedAt);
        }

        JobOutcome outcome = finishOrLose(job, status, JobStatus.COMPLETED, null,
                JobOutcome.Disposition.COMPLETED, startedAt);
        if (outcome.getDisposition() == JobOutcome.Disposition.COMPLETED) {
            log.info("Job completed: id={}, type={}, attempts={}", job.getId(), job.getType(), job.getAttempts());
        }
        return outcome;
    }

    private JobOutcome finishOrLose(Job job, TransactionStatus status, JobStatus jobStatus, String note,
                                    JobOutcome.Disposition disposition, long startedAt) {
        if (jobRepository.finish(job.getId(), job.getAttempts(), jobStatus.name(), note) == 0) {
            // Another worker owns the job now; its run decides the outcome.
            status.setRollbackOnly();
            log.warn("Job claim lost, discarding this run: id={}, type={}, attempts={}",
                    job.getId(), job.getType(), job.getAttempts());
            return finish(job, JobOutcome.Disposition.CLAIM_LOST, null, startedAt);
        }
        return finish(job, disposition, note, startedAt);
    }

    private JobOutcome recordFailure(Job job, JobHandler handler, RuntimeException error, long startedAt) {
        boolean permanent = error instanceof NonRetryableJobException;
        boolean terminal = permanent || job.getAttempts() >= maxAttempts;
        String message = truncate(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());

        int updated;
        JobOutcome.Disposition disposition;
        if (terminal) {
            updated = jobRepository.finish(job.getId(), job.getAttempts(), JobStatus.FAILED.name(), message);
            disposition = JobOutcome.Disposition.FAILED;
        } else {
            updated = jobRepository.reschedule(job.getId(), job.getAttempts(), message,
                    backoffDelayMs(job.getAttempts()));
            disposition = JobOutcome.Disposition.RETRY_SCHEDULED;
        }

        if (updated == 0) {
            log.warn("Job claim lost before its failure was recorded: id={}, type={}, attempts={}, error={}",
                    job.getId(), job.getType(), job.getAttempts(), message);
            return finish(job, JobOutcome.Disposition.CLAIM_LOST, message, startedAt);
        }

        if (terminal) {
            log.error("Job failed: id={}, type={}, attempts={}, permanent={}, error={}",
                    job.getId(), job.getType(), job.getAttempts(), permanent, message);
        } else {
            log.warn("Job attempt failed, retrying: id={}, type={}, attempts={}/{}, retryInMs={}, error={}",
                    job.getId(), job.getType(), job.getAttempts(), maxAttempts,
                    backoffDelayMs(job.getAttempts()), message);
        }

        if (handler != null) {
            notifyFailure(job, handler, error, terminal);
        }
        return finish(job, disposition, message, startedAt);
    }

    private void notifyFailure(Job job, JobHandler handler, RuntimeException error, boolean terminal) {
        try {
            nestedTransactionTemplate.executeWithoutResult(s -> handler.onFailure(job, error, terminal));
        } catch (RuntimeException e) {
            // The job's status must still be recorded.
            log.error("Job failure callback threw: id={}, type={}, error={}",
                    job.getId(), job.getType(), e.getMessage(), e);
        }
    }

    private JobOutcome finish(Job job, JobOutcome.Disposition disposition, String error, long startedAt) {
        jobMetrics.recordJobProcessed(job.getType(), disposition.name().toLowerCase(),
                Duration.ofNanos(System.nanoTime() - startedAt));
        return new JobOutcome(job.getId(), job.getType(), job.getAttempts(), disposition, error);
    }

    /**
     * Exponential backoff: base * 2^(attempts - 1), capped at the maximum.
     */
    long backoffDelayMs(int attempts) {
        if (baseBackoffMs == 0) {
            return 0;
        }
        int exponent = Math.min(Math.max(attempts - 1, 0), 30);
        long delay = baseBackoffMs * (1L << exponent);
        if (delay < 0 || delay > maxBackoffMs) {
            return maxBackoffMs;
        }
        return delay;
    }

    private static String truncate(String message) {
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
