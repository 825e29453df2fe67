package com.flagship.points_ledger.withdraw;

import lombok.Value;

/**
 * What the caller gets back for a withdraw submission. Stored as the
 * idempotent response, so a retried submission gets the same receipt.
 */
@Value
public class WithdrawReceipt {
    long withdrawId;
    long amount;
    long balance;
    WithdrawStatus status;
}
