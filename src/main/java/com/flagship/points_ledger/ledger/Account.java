package com.flagship.points_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * A user's economic state.
 *
 * {@code balance} is a cache of the sum of the account's ledger entries, kept
 * in step by {@link LedgerService}. Accounts are never deleted.
 */
@Value
public class Account {
    long id;
    long balance;
    Instant createdAt;
}
