package com.flagship.points_ledger.withdraw;

import lombok.Value;

import java.time.Instant;

/**
 * A user's request to withdraw points. The amount is reserved from the
 * balance when the request is created.
 */
@Value
public class WithdrawRequest {
    long id;
    long accountId;
    long amount;
    String address;
    WithdrawStatus status;
    Instant createdAt;
    Instant reviewedAt;
    Instant paidAt;
    String rejectReason;
    String payoutProvider;
    String payoutTxId;
    String payoutError;
}
