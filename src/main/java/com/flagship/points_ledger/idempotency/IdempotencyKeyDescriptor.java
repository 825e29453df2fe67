package com.flagship.points_ledger.idempotency;

import lombok.Value;

/**
 * Natural key of one retriable operation: which operation ({@code endpoint}),
 * the caller's request id, and an optional scope ({@code context}) such as the
 * account the request acts on.
 *
 * A missing context is stored as the empty string, so {@code (e, r, null)}
 * and {@code (e, r, "")} are the same key.
 */
@Value
public class IdempotencyKeyDescriptor {
    String endpoint;
    String requestId;
    String context;
    Long accountId;

    public IdempotencyKeyDescriptor(String endpoint, String requestId, String context, Long accountId) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        this.endpoint = endpoint.trim();
        this.requestId = requestId.trim();
        this.context = context != null ? context.trim() : "";
        this.accountId = accountId;
    }

    public static IdempotencyKeyDescriptor of(String endpoint, String requestId) {
        return new IdempotencyKeyDescriptor(endpoint, requestId, null, null);
    }

    /**
     * Key scoped to an account: the account id is both the context and the owner.
     */
    public static IdempotencyKeyDescriptor forAccount(String endpoint, String requestId, long accountId) {
        return new IdempotencyKeyDescriptor(endpoint, requestId, String.valueOf(accountId), accountId);
    }
}
