package com.flagship.points_ledger.ledger;

import com.flagship.points_ledger.AbstractIntegrationTest;
import com.flagship.points_ledger.jobs.JobOutcome;
import com.flagship.points_ledger.jobs.JobQueue;
import com.flagship.points_ledger.jobs.JobTypes;
import com.flagship.points_ledger.jobs.JobWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the sync_account job, run through the real worker.
 */
class SyncAccountJobHandlerTest extends AbstractIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private JobWorker jobWorker;

    @Test
    @DisplayName("A requested reconciliation fixes a drifted balance")
    void testReconciliationJobFixesDrift() {
        long accountId = accountService.createAccount();
        ledgerService.applyBalanceChange(BalanceChange.credit(accountId, 300, LedgerReasons.MISSION_REWARD));
        jdbcTemplate.update("UPDATE accounts SET balance = 5 WHERE id = ?", accountId);

        Long jobId = ledgerService.requestReconciliation(accountId);
        JobOutcome outcome = jobWorker.processNextJob().orElseThrow();

        assertEquals(jobId, outcome.getJobId());
        assertEquals(JobOutcome.Disposition.COMPLETED, outcome.getDisposition());
        assertEquals(300, cachedBalance(accountId));
        assertEquals(1, countRows("ledger_entries"));
    }

    @Test
    @DisplayName("The legacy user_id payload key is still understood")
    void testLegacyPayloadKey() {
        long accountId = accountService.createAccount();
        jdbcTemplate.update("UPDATE accounts SET balance = 77 WHERE id = ?", accountId);

        jobQueue.enqueue(JobTypes.SYNC_ACCOUNT, Map.of("user_id", accountId));

        assertEquals(JobOutcome.Disposition.COMPLETED, jobWorker.processNextJob().orElseThrow().getDisposition());
        assertEquals(0, cachedBalance(accountId));
    }

    @Test
    @DisplayName("A missing account fails the job without retrying")
    void testMissingAccountIsPermanent() {
        Long jobId = jobQueue.enqueue(JobTypes.SYNC_ACCOUNT, Map.of("account_id", 123456));

        JobOutcome outcome = jobWorker.processNextJob().orElseThrow();

        assertEquals(JobOutcome.Disposition.FAILED, outcome.getDisposition());
        assertEquals(1, jobAttempts(jobId));
    }

    @Test
    @DisplayName("A payload without an account id fails the job without retrying")
    void testMissingAccountIdIsPermanent() {
        Long jobId = jobQueue.enqueue(JobTypes.SYNC_ACCOUNT, Map.of("something", "else"));

        JobOutcome outcome = jobWorker.processNextJob().orElseThrow();

        assertEquals(JobOutcome.Disposition.FAILED, outcome.getDisposition());
        assertEquals("FAILED", jobStatus(jobId));
        assertTrue(outcome.getError().contains("account_id"));
    }
}
