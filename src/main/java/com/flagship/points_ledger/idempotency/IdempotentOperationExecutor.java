package com.flagship.points_ledger.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.points_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs an effectful operation at most once per idempotency key.
 *
 * Usage:
 * <pre>
 * IdempotentResult&lt;Receipt&gt; result = executor.execute(
 *     IdempotencyKeyDescriptor.forAccount("withdraw.request", requestId, accountId),
 *     Receipt.class,
 *     () -> {
 *         // balance changes and other writes; runs only for a new key
 *         return receipt;
 *     });
 * </pre>
 *
 * The key, the operation's writes and the stored response share one
 * transaction (the caller's, if one is active). If the operation throws,
 * everything rolls back including the key, so the request can be retried.
 * When the executor joins a caller's transaction, a failure marks that whole
 * transaction rollback-only.
 * A replay returns the stored response deserialized as {@code responseType};
 * the response type must therefore round-trip through Jackson.
 */
@Service
@Slf4j
public class IdempotentOperationExecutor {

    private final IdempotencyService idempotencyService;
    private final IdempotencyResponseCache responseCache;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics ledgerMetrics;

    public IdempotentOperationExecutor(IdempotencyService idempotencyService,
                                       IdempotencyResponseCache responseCache,
                                       TransactionTemplate transactionTemplate,
                                       ObjectMapper objectMapper,
                                       LedgerMetrics ledgerMetrics) {
        this.idempotencyService = idempotencyService;
        this.responseCache = responseCache;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.ledgerMetrics = ledgerMetrics;
    }

    public <T> IdempotentResult<T> execute(IdempotencyKeyDescriptor descriptor,
                                           Class<T> responseType,
                                           Supplier<T> operation) {
        Optional<String> cached = responseCache.find(descriptor);
        if (cached.isPresent()) {
            log.info("Idempotent replay from Redis: endpoint={}, requestId={}",
                    descriptor.getEndpoint(), descriptor.getRequestId());
            ledgerMetrics.recordIdempotencyHit("redis");
            return IdempotentResult.replayed(fromJson(cached.get(), responseType), IdempotencyStatus.COMPLETED);
        }

        return transactionTemplate.execute(status -> {
            try {
                return executeOnce(descriptor, responseType, operation);
            } catch (RuntimeException e) {
                // Applies to a joined caller transaction as well: the operation's
                // writes never commit without a completed key.
                status.setRollbackOnly();
                throw e;
            }
        });
    }

    private <T> IdempotentResult<T> executeOnce(IdempotencyKeyDescriptor descriptor,
                                                Class<T> responseType,
                                                Supplier<T> operation) {
        IdempotencyKey key = idempotencyService.ensureKey(descriptor);

        if (key.isTerminal()) {
            log.info("Idempotent replay from database: endpoint={}, requestId={}, status={}",
                    descriptor.getEndpoint(), descriptor.getRequestId(), key.getStatus());
            ledgerMetrics.recordIdempotencyHit("database");
            return IdempotentResult.replayed(fromJson(key.getResponse(), responseType), key.getStatus());
        }

        ledgerMetrics.recordIdempotencyMiss();
        T value = operation.get();
        IdempotencyKey completed = idempotencyService.completeKey(descriptor, value);
        cacheAfterCommit(descriptor, completed.getResponse());
        return IdempotentResult.executed(value);
    }

    private void cacheAfterCommit(IdempotencyKeyDescriptor descriptor, String responseJson) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                responseCache.store(descriptor, responseJson);
            }
        });
    }

    private <T> T fromJson(String json, Class<T> responseType) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, responseType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored idempotent response cannot be read as "
                    + responseType.getSimpleName(), e);
        }
    }
}
