package com.flagship.points_ledger.ledger;

import lombok.Getter;

/**
 * Raised by callers that guard a debit against the locked account balance.
 * {@link LedgerService} itself never raises it.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final long accountId;
    private final long balance;
    private final long requested;

    public InsufficientBalanceException(long accountId, long balance, long requested) {
        super(String.format("Insufficient balance on account %d: balance=%d, requested=%d",
                accountId, balance, requested));
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }
}
