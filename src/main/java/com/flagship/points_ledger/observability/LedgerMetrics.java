package com.flagship.points_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for balance mutations and the idempotency gate.
 *
 * Metrics exposed:
 * - ledger.balance_changes: Counter of applied changes, tagged by reason and direction
 * - ledger.balance_change.duration: Timer for the mutation engine
 * - ledger.reconciliation.corrections: Counter of cached balances fixed from the ledger
 * - idempotency.lookups: Counter of gate lookups, tagged by result and source
 * - withdraw.requests: Counter of withdraw lifecycle transitions
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Timer balanceChangeTimer;
    private final Counter reconciliationCorrections;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.balanceChangeTimer = Timer.builder("ledger.balance_change.duration")
                .description("Time taken to apply a balance change")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.reconciliationCorrections = Counter.builder("ledger.reconciliation.corrections")
                .description("Number of cached balances corrected from the ledger")
                .register(registry);
    }

    public void recordBalanceChange(String reason, long delta, Duration duration) {
        registry.counter("ledger.balance_changes",
                "reason", sanitizeTag(reason),
                "direction", delta > 0 ? "credit" : "debit"
        ).increment();
        balanceChangeTimer.record(duration);
    }

    public void incrementReconciliationCorrections() {
        reconciliationCorrections.increment();
    }

    /**
     * Records a replayed request.
     *
     * @param source "redis" or "database"
     */
    public void recordIdempotencyHit(String source) {
        registry.counter("idempotency.lookups", "result", "hit", "source", source).increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.lookups", "result", "miss", "source", "database").increment();
    }

    public void recordWithdrawTransition(String status) {
        registry.counter("withdraw.requests", "status", sanitizeTag(status)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
