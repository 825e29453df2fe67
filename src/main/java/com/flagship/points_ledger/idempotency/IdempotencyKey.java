package com.flagship.points_ledger.idempotency;

import lombok.Value;

import java.time.Instant;

/**
 * A stored idempotency key. {@code response} is the JSON recorded when the
 * key was completed, and is null while the key is pending.
 */
@Value
public class IdempotencyKey {
    long id;
    String endpoint;
    String requestId;
    String context;
    Long accountId;
    IdempotencyStatus status;
    String response;
    Instant createdAt;
    Instant updatedAt;

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
