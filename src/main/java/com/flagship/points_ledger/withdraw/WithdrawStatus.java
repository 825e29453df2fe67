package com.flagship.points_ledger.withdraw;

/**
 * PENDING -> APPROVED -> PAID, or PENDING/APPROVED -> REJECTED (refunded).
 */
public enum WithdrawStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PAID;

    public boolean isFinal() {
        return this == PAID || this == REJECTED;
    }
}
