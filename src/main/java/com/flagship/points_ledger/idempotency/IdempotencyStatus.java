package com.flagship.points_ledger.idempotency;

public enum IdempotencyStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
