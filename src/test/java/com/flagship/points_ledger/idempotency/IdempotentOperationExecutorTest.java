package com.flagship.points_ledger.idempotency;

import com.flagship.points_ledger.AbstractIntegrationTest;
import com.flagship.points_ledger.ledger.AccountService;
import com.flagship.points_ledger.ledger.BalanceChange;
import com.flagship.points_ledger.ledger.BalanceChangeResult;
import com.flagship.points_ledger.ledger.LedgerReasons;
import com.flagship.points_ledger.ledger.LedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.transaction.UnexpectedRollbackException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for at-most-once execution of balance changes behind an idempotency key.
 */
class IdempotentOperationExecutorTest extends AbstractIntegrationTest {

    @Autowired
    private IdempotentOperationExecutor executor;

    @Autowired
    private IdempotencyService idempotencyService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private IdempotencyKeyDescriptor bonusKey(long accountId, String requestId) {
        return IdempotencyKeyDescriptor.forAccount("daily.bonus", requestId, accountId);
    }

    private IdempotentResult<BalanceChangeResult> claimBonus(long accountId, String requestId, AtomicInteger invocations) {
        return executor.execute(bonusKey(accountId, requestId), BalanceChangeResult.class, () -> {
            invocations.incrementAndGet();
            return ledgerService.applyBalanceChange(BalanceChange.credit(accountId, 100, LedgerReasons.DAILY_BONUS));
        });
    }

    @Test
    @DisplayName("A retried request replays the stored result without a second ledger entry")
    void testRetryReplaysStoredResult() {
        printTestHeader("Retry replays stored result");

        long accountId = accountService.createAccount();
        AtomicInteger invocations = new AtomicInteger();

        IdempotentResult<BalanceChangeResult> first = claimBonus(accountId, "bonus-2024-05-01", invocations);
        IdempotentResult<BalanceChangeResult> second = claimBonus(accountId, "bonus-2024-05-01", invocations);

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(IdempotencyStatus.COMPLETED, second.getStatus());
        assertEquals(first.getValue(), second.getValue());
        assertEquals(1, invocations.get());
        assertEquals(1, ledgerService.getEntriesForAccount(accountId).size());
        assertEquals(100, cachedBalance(accountId));

        printSuccess("Second call replayed with zero additional ledger entries");
    }

    @Test
    @DisplayName("Different request ids are independent operations")
    void testDifferentRequestIds() {
        long accountId = accountService.createAccount();
        AtomicInteger invocations = new AtomicInteger();

        claimBonus(accountId, "a", invocations);
        claimBonus(accountId, "b", invocations);

        assertEquals(2, invocations.get());
        assertEquals(200, cachedBalance(accountId));
    }

    @Test
    @DisplayName("Concurrent identical requests apply the effect exactly once")
    void testConcurrentIdenticalRequests() throws Exception {
        printTestHeader("Concurrent identical requests");

        long accountId = accountService.createAccount();
        AtomicInteger invocations = new AtomicInteger();
        int callers = 6;

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IdempotentResult<BalanceChangeResult>>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return claimBonus(accountId, "same-request", invocations);
            }));
        }
        start.countDown();

        int executed = 0;
        int replayed = 0;
        for (Future<IdempotentResult<BalanceChangeResult>> future : futures) {
            IdempotentResult<BalanceChangeResult> result = future.get(30, TimeUnit.SECONDS);
            if (result.isReplayed()) {
                replayed++;
            } else {
                executed++;
            }
        }
        pool.shutdown();

        assertEquals(1, executed);
        assertEquals(callers - 1, replayed);
        assertEquals(1, invocations.get());
        assertEquals(1, countRows("idempotency_keys"));
        assertEquals(1, ledgerService.getEntriesForAccount(accountId).size());
        assertEquals(100, cachedBalance(accountId));

        printSuccess("One execution, " + replayed + " replays");
    }

    @Test
    @DisplayName("A failed operation leaves no key behind, so the request can be retried")
    void testFailedOperationCanBeRetried() {
        long accountId = accountService.createAccount();
        IdempotencyKeyDescriptor key = bonusKey(accountId, "flaky");

        assertThrows(IllegalStateException.class, () -> executor.execute(key, BalanceChangeResult.class, () -> {
            ledgerService.applyBalanceChange(BalanceChange.credit(accountId, 100, LedgerReasons.DAILY_BONUS));
            throw new IllegalStateException("downstream failure");
        }));

        assertTrue(idempotencyService.findKey(key).isEmpty());
        assertEquals(0, cachedBalance(accountId));
        assertEquals(0, countRows("ledger_entries"));

        IdempotentResult<BalanceChangeResult> retried = claimBonus(accountId, "flaky", new AtomicInteger());
        assertFalse(retried.isReplayed());
        assertEquals(100, cachedBalance(accountId));
    }

    @Test
    @DisplayName("A failure inside a caller's transaction cannot be committed by the caller")
    void testFailureInJoinedTransactionRollsBackCaller() {
        printTestHeader("Failure swallowed by the enclosing transaction");

        long accountId = accountService.createAccount();
        IdempotencyKeyDescriptor key = bonusKey(accountId, "swallowed");

        assertThrows(UnexpectedRollbackException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            try {
                executor.execute(key, BalanceChangeResult.class, () -> {
                    ledgerService.applyBalanceChange(BalanceChange.credit(accountId, 100, LedgerReasons.DAILY_BONUS));
                    throw new IllegalStateException("downstream failure");
                });
            } catch (IllegalStateException expected) {
                // The caller carries on and tries to commit.
            }
        }));

        assertTrue(idempotencyService.findKey(key).isEmpty());
        assertEquals(0, countRows("ledger_entries"));

        IdempotentResult<BalanceChangeResult> retried = claimBonus(accountId, "swallowed", new AtomicInteger());
        assertFalse(retried.isReplayed());
        assertEquals(1, ledgerService.getEntriesForAccount(accountId).size());
        assertEquals(100, cachedBalance(accountId));

        printSuccess("Caller's commit refused, retry credited once");
    }

    @Test
    @DisplayName("Completed responses are written to Redis after commit")
    void testResponseCachedAfterCommit() {
        long accountId = accountService.createAccount();

        claimBonus(accountId, "cache-me", new AtomicInteger());

        verify(valueOperations).set(
            eq(IdempotencyResponseCache.redisKey(bonusKey(accountId, "cache-me"))), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("A Redis hit replays without touching the database")
    void testRedisHitReplays() {
        when(valueOperations.get("idempotency:11:daily.bonus:1:7:cached")).thenReturn("\"from-redis\"");
        AtomicInteger invocations = new AtomicInteger();

        IdempotentResult<String> result = executor.execute(bonusKey(7, "cached"), String.class, () -> {
            invocations.incrementAndGet();
            return "fresh";
        });

        assertTrue(result.isReplayed());
        assertEquals("from-redis", result.getValue());
        assertEquals(0, invocations.get());
        assertEquals(0, countRows("idempotency_keys"));
    }

    @Test
    @DisplayName("A Redis outage falls back to the database")
    void testRedisOutageFallsBackToDatabase() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("redis down"));
        long accountId = accountService.createAccount();
        AtomicInteger invocations = new AtomicInteger();

        IdempotentResult<BalanceChangeResult> first = claimBonus(accountId, "no-redis", invocations);
        IdempotentResult<BalanceChangeResult> second = claimBonus(accountId, "no-redis", invocations);

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(1, invocations.get());
        assertEquals(1, ledgerService.getEntriesForAccount(accountId).size());
    }
}
