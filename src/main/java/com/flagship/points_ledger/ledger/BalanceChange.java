package com.flagship.points_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * A request to move an account's balance by {@code delta} minor units.
 *
 * Negative deltas are debits (spends, reservations), positive ones credits.
 * Construction validates the intent, so a malformed change is rejected before
 * any transaction is opened.
 */
@Value
public class BalanceChange {
    long accountId;
    long delta;
    String reason;
    LedgerReference reference;
    String eventType;

    @Builder
    public BalanceChange(long accountId, long delta, String reason, LedgerReference reference, String eventType) {
        if (accountId <= 0) {
            throw new IllegalArgumentException("accountId must be positive, got " + accountId);
        }
        if (delta == 0) {
            throw new IllegalArgumentException("delta must be nonzero");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason is required");
        }
        this.accountId = accountId;
        this.delta = delta;
        this.reason = reason.trim();
        this.reference = reference;
        this.eventType = eventType != null && !eventType.isBlank() ? eventType.trim() : null;
    }

    public static BalanceChange credit(long accountId, long amount, String reason) {
        return new BalanceChange(accountId, Math.abs(amount), reason, null, null);
    }

    public static BalanceChange debit(long accountId, long amount, String reason) {
        return new BalanceChange(accountId, -Math.abs(amount), reason, null, null);
    }

    /**
     * The analytics category written with the entry: the explicit one, else
     * one derived from the reference kind, else the reason itself.
     */
    public String effectiveEventType() {
        if (eventType != null) {
            return eventType;
        }
        if (reference != null) {
            return reference.defaultEventType();
        }
        return reason;
    }
}
