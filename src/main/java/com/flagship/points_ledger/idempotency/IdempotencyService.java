package com.flagship.points_ledger.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Idempotency keys stored in PostgreSQL.
 *
 * Both write operations require the caller's transaction. The caller brackets
 * its effectful work with them:
 * <pre>
 * begin
 *   key = ensureKey(descriptor)        -- row locked from here on
 *   if key is terminal: return key.response
 *   result = doWork()
 *   completeKey(descriptor, result)
 * commit
 * </pre>
 * so "effect applied" and "key completed" commit atomically.
 *
 * Two callers racing on one natural key cannot both proceed: the loser's
 * insert waits on the winner's uncommitted row, then sees it and locks it.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String COLUMNS =
            "id, endpoint, request_id, context, account_id, status, response::text AS response, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public IdempotencyService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the key for the descriptor, creating it as PENDING if absent.
     * The row stays locked until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IdempotencyKey ensureKey(IdempotencyKeyDescriptor descriptor) {
        Optional<IdempotencyKey> existing = selectForUpdate(descriptor);
        if (existing.isPresent()) {
            return existing.get();
        }

        List<IdempotencyKey> inserted = jdbcTemplate.query(
            "INSERT INTO idempotency_keys (endpoint, request_id, context, account_id, status) " +
            "VALUES (?, ?, ?, ?, 'PENDING') " +
            "ON CONFLICT (endpoint, request_id, context) DO NOTHING " +
            "RETURNING " + COLUMNS,
            keyRowMapper(),
            descriptor.getEndpoint(),
            descriptor.getRequestId(),
            descriptor.getContext(),
            descriptor.getAccountId()
        );
        if (!inserted.isEmpty()) {
            log.debug("Created idempotency key: endpoint={}, requestId={}, context={}",
                    descriptor.getEndpoint(), descriptor.getRequestId(), descriptor.getContext());
            return inserted.get(0);
        }

        // Lost the insert race; the winner has committed by now.
        return selectForUpdate(descriptor).orElseThrow(() -> new IllegalStateException(
                "Idempotency key vanished after conflicting insert: " + describe(descriptor)));
    }

    /**
     * Marks a pending key COMPLETED and stores the response.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IdempotencyKey completeKey(IdempotencyKeyDescriptor descriptor, Object response) {
        return completeKey(descriptor, response, IdempotencyStatus.COMPLETED);
    }

    /**
     * Moves a pending key to a terminal status and stores the response.
     *
     * @throws IllegalArgumentException if {@code status} is not terminal
     * @throws IllegalStateException if the key does not exist or is already terminal
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IdempotencyKey completeKey(IdempotencyKeyDescriptor descriptor, Object response, IdempotencyStatus status) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Idempotency key can only be completed with a terminal status, got " + status);
        }

        List<IdempotencyKey> updated = jdbcTemplate.query(
            "UPDATE idempotency_keys SET status = ?, response = CAST(? AS jsonb), updated_at = NOW() " +
            "WHERE endpoint = ? AND request_id = ? AND context = ? AND status = 'PENDING' " +
            "RETURNING " + COLUMNS,
            keyRowMapper(),
            status.name(),
            toJson(response),
            descriptor.getEndpoint(),
            descriptor.getRequestId(),
            descriptor.getContext()
        );
        if (updated.isEmpty()) {
            IdempotencyKey current = findKey(descriptor).orElseThrow(() -> new IllegalStateException(
                    "Idempotency key does not exist: " + describe(descriptor)));
            throw new IllegalStateException(String.format(
                    "Idempotency key %s is already %s", describe(descriptor), current.getStatus()));
        }

        log.debug("Completed idempotency key: endpoint={}, requestId={}, context={}, status={}",
                descriptor.getEndpoint(), descriptor.getRequestId(), descriptor.getContext(), status);
        return updated.get(0);
    }

    @Transactional(readOnly = true)
    public Optional<IdempotencyKey> findKey(IdempotencyKeyDescriptor descriptor) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM idempotency_keys WHERE endpoint = ? AND request_id = ? AND context = ?",
            keyRowMapper(),
            descriptor.getEndpoint(),
            descriptor.getRequestId(),
            descriptor.getContext()
        ).stream().findFirst();
    }

    private Optional<IdempotencyKey> selectForUpdate(IdempotencyKeyDescriptor descriptor) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM idempotency_keys " +
            "WHERE endpoint = ? AND request_id = ? AND context = ? FOR UPDATE",
            keyRowMapper(),
            descriptor.getEndpoint(),
            descriptor.getRequestId(),
            descriptor.getContext()
        ).stream().findFirst();
    }

    private String toJson(Object response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Idempotent response is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(IdempotencyKeyDescriptor descriptor) {
        return descriptor.getEndpoint() + "/" + descriptor.getRequestId() + "/" + descriptor.getContext();
    }

    private static RowMapper<IdempotencyKey> keyRowMapper() {
        return (rs, rowNum) -> {
            long accountId = rs.getLong("account_id");
            Long owner = rs.wasNull() ? null : accountId;
            return new IdempotencyKey(
                rs.getLong("id"),
                rs.getString("endpoint"),
                rs.getString("request_id"),
                rs.getString("context"),
                owner,
                IdempotencyStatus.valueOf(rs.getString("status")),
                rs.getString("response"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        };
    }
}
