package com.flagship.points_ledger.jobs;

import com.flagship.points_ledger.AbstractIntegrationTest;
import com.flagship.points_ledger.ledger.AccountService;
import com.flagship.points_ledger.ledger.BalanceChange;
import com.flagship.points_ledger.ledger.LedgerReasons;
import com.flagship.points_ledger.ledger.LedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for enqueueing, including behaviour while the jobs table is unavailable.
 */
class JobQueueTest extends AbstractIntegrationTest {

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private JobWorker jobWorker;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("Enqueue stores a due pending job with its payload")
    void testEnqueueStoresPendingJob() {
        Long jobId = jobQueue.enqueue(JobTypes.SYNC_ACCOUNT, Map.of("account_id", 5));

        assertNotNull(jobId);
        assertEquals("PENDING", jobStatus(jobId));
        assertEquals(0, jobAttempts(jobId));
        assertEquals("BEST_EFFORT",
            jdbcTemplate.queryForObject("SELECT criticality FROM jobs WHERE id = ?", String.class, jobId));
        assertEquals(5L,
            jdbcTemplate.queryForObject("SELECT (payload->>'account_id')::bigint FROM jobs WHERE id = ?", Long.class, jobId));
    }

    @Test
    @DisplayName("A null payload is stored as an empty object")
    void testNullPayload() {
        Long jobId = jobQueue.enqueue(TestJobHandlers.COUNT, null);

        assertEquals("{}", jdbcTemplate.queryForObject("SELECT payload::text FROM jobs WHERE id = ?", String.class, jobId));
    }

    @Test
    @DisplayName("A blank job type is rejected")
    void testBlankTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> jobQueue.enqueue(" ", Map.of()));
        assertEquals(0, countRows("jobs"));
    }

    @Test
    @DisplayName("A job scheduled in the future is not claimed before its run time")
    void testFutureJobNotClaimed() {
        Long jobId = jobQueue.enqueue(TestJobHandlers.COUNT, Map.of(),
            EnqueueOptions.bestEffort().withRunAt(Instant.now().plus(Duration.ofHours(1))));

        assertTrue(jobWorker.processNextJob().isEmpty());
        assertEquals("PENDING", jobStatus(jobId));
        assertEquals(0, jobAttempts(jobId));
    }

    @Test
    @DisplayName("A rolled-back caller takes its enqueued job with it")
    void testEnqueueJoinsCallerTransaction() {
        assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            jobQueue.enqueue(TestJobHandlers.COUNT, Map.of());
            throw new IllegalStateException("caller failed");
        }));

        assertEquals(0, countRows("jobs"));
    }

    @Test
    @DisplayName("A best-effort enqueue during an outage returns null and the caller commits")
    void testBestEffortEnqueueDuringOutage() {
        printTestHeader("Best-effort enqueue during jobs table outage");

        jdbcTemplate.execute("ALTER TABLE jobs RENAME TO jobs_offline");
        try {
            Long accountId = transactionTemplate.execute(status -> {
                long id = accountService.createAccount();
                Long jobId = jobQueue.enqueue(JobTypes.SYNC_ACCOUNT, Map.of("account_id", id));
                assertNull(jobId);
                ledgerService.applyBalanceChangeInTransaction(BalanceChange.credit(id, 50, LedgerReasons.DAILY_BONUS));
                return id;
            });

            assertNotNull(accountId);
            assertEquals(50, cachedBalance(accountId));
            assertEquals(1, countRows("ledger_entries"));
        } finally {
            jdbcTemplate.execute("ALTER TABLE jobs_offline RENAME TO jobs");
        }
        assertEquals(0, countRows("jobs"));

        printSuccess("Enqueue returned null and the caller's transaction committed");
    }

    @Test
    @DisplayName("A required enqueue during an outage fails the caller's transaction")
    void testRequiredEnqueueDuringOutage() {
        jdbcTemplate.execute("ALTER TABLE jobs RENAME TO jobs_offline");
        try {
            assertThrows(JobEnqueueException.class, () -> transactionTemplate.executeWithoutResult(status -> {
                accountService.createAccount();
                jobQueue.enqueue(JobTypes.WITHDRAW_PAYOUT, Map.of("withdraw_id", 1), EnqueueOptions.required());
            }));
        } finally {
            jdbcTemplate.execute("ALTER TABLE jobs_offline RENAME TO jobs");
        }

        assertEquals(0, countRows("accounts"));
    }
}
