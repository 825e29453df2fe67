package com.flagship.points_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * One immutable balance change. Ids are monotonic, so ordering by id gives
 * the order in which changes to an account were applied.
 */
@Value
public class LedgerEntry {
    long id;
    long accountId;
    long delta;
    String reason;
    LedgerReference reference;
    String eventType;
    Instant createdAt;

    public Optional<LedgerReference> getReferenceIfPresent() {
        return Optional.ofNullable(reference);
    }
}
