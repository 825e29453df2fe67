package com.flagship.points_ledger.ledger;

import lombok.Getter;

/**
 * Raised when an operation references an account that does not exist.
 * The enclosing transaction is rolled back.
 */
@Getter
public class AccountNotFoundException extends RuntimeException {

    private final long accountId;

    public AccountNotFoundException(long accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }
}
