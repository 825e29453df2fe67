package com.flagship.points_ledger.withdraw;

import lombok.Value;

/**
 * A validated withdraw submission. {@code requestId} is the client's retry
 * key: resubmitting with the same id returns the first receipt.
 */
@Value
public class WithdrawCommand {
    long accountId;
    long amount;
    String address;
    String requestId;

    public WithdrawCommand(long accountId, long amount, String address, String requestId) {
        if (accountId <= 0) {
            throw new IllegalArgumentException("accountId must be positive, got " + accountId);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive, got " + amount);
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        this.accountId = accountId;
        this.amount = amount;
        this.address = address.trim();
        this.requestId = requestId.trim();
    }
}
