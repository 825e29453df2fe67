package com.flagship.points_ledger.idempotency;

import lombok.Value;

/**
 * Result of {@link IdempotentOperationExecutor#execute}.
 *
 * {@code replayed} is true when the value was read back from an earlier
 * execution instead of being produced now.
 */
@Value
public class IdempotentResult<T> {
    T value;
    boolean replayed;
    IdempotencyStatus status;

    static <T> IdempotentResult<T> executed(T value) {
        return new IdempotentResult<>(value, false, IdempotencyStatus.COMPLETED);
    }

    static <T> IdempotentResult<T> replayed(T value, IdempotencyStatus status) {
        return new IdempotentResult<>(value, true, status);
    }
}
