package com.flagship.points_ledger.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.points_ledger.config.TransactionConfig;
import com.flagship.points_ledger.observability.JobMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;

/**
 * Durable, at-least-once job queue backed by the {@code jobs} table.
 *
 * Enqueue behaviour depends on {@link JobCriticality}:
 * - BEST_EFFORT: the insert runs in a savepoint. If it fails, the savepoint
 *   is rolled back, the failure is logged and counted, and {@code null} is
 *   returned. The caller's transaction is left usable.
 * - REQUIRED: the insert joins the caller's transaction and failures
 *   propagate as {@link JobEnqueueException}, so the triggering change and
 *   its follow-up job commit together or not at all.
 *
 * Without an active transaction each enqueue commits on its own.
 */
@Service
@Slf4j
public class JobQueue {

    private static final String INSERT_DUE_NOW = """
            INSERT INTO jobs (type, payload, status, criticality, run_at)
            VALUES (?, CAST(? AS jsonb), 'PENDING', ?, NOW())
            RETURNING id
            """;

    private static final String INSERT_SCHEDULED = """
            INSERT INTO jobs (type, payload, status, criticality, run_at)
            VALUES (?, CAST(? AS jsonb), 'PENDING', ?, ?)
            RETURNING id
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate nestedTransactionTemplate;
    private final JobMetrics jobMetrics;

    public JobQueue(JdbcTemplate jdbcTemplate,
                    ObjectMapper objectMapper,
                    TransactionTemplate transactionTemplate,
                    @Qualifier(TransactionConfig.NESTED_TRANSACTION_TEMPLATE) TransactionTemplate nestedTransactionTemplate,
                    JobMetrics jobMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.nestedTransactionTemplate = nestedTransactionTemplate;
        this.jobMetrics = jobMetrics;
    }

    /**
     * Enqueues a best-effort job that is due immediately.
     *
     * @return the job id, or {@code null} if the job could not be stored
     */
    public Long enqueue(String type, Object payload) {
        return enqueue(type, payload, EnqueueOptions.bestEffort());
    }

    /**
     * Enqueues a job.
     *
     * @param payload any value Jackson can serialize; {@code null} becomes {@code {}}
     * @return the job id; {@code null} only for a BEST_EFFORT job that could not be stored
     * @throws IllegalArgumentException if the type is blank
     * @throws JobEnqueueException if a REQUIRED job could not be stored
     */
    public Long enqueue(String type, Object payload, EnqueueOptions options) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Job type is required");
        }
        EnqueueOptions effective = options != null ? options : EnqueueOptions.bestEffort();

        if (effective.getCriticality() == JobCriticality.REQUIRED) {
            return enqueueRequired(type, payload, effective);
        }
        return enqueueBestEffort(type, payload, effective);
    }

    private Long enqueueRequired(String type, Object payload, EnqueueOptions options) {
        try {
            String json = toJson(payload);
            Long id = transactionTemplate.execute(status -> insert(type, json, options));
            jobMetrics.recordJobEnqueued(type, options.getCriticality().name());
            log.info("Enqueued job: id={}, type={}, criticality={}", id, type, options.getCriticality());
            return id;
        } catch (RuntimeException e) {
            log.error("Failed to enqueue required job: type={}, error={}", type, e.getMessage());
            jobMetrics.recordEnqueueFailure(type, options.getCriticality().name());
            throw new JobEnqueueException(type, e);
        }
    }

    private Long enqueueBestEffort(String type, Object payload, EnqueueOptions options) {
        try {
            String json = toJson(payload);
            Long id = nestedTransactionTemplate.execute(status -> insert(type, json, options));
            jobMetrics.recordJobEnqueued(type, options.getCriticality().name());
            log.info("Enqueued job: id={}, type={}, criticality={}", id, type, options.getCriticality());
            return id;
        } catch (RuntimeException e) {
            // The caller's flow must not depend on a best-effort job.
            log.error("Failed to enqueue job, continuing without it: type={}, error={}", type, e.getMessage());
            jobMetrics.recordEnqueueFailure(type, options.getCriticality().name());
            return null;
        }
    }

    private Long insert(String type, String payloadJson, EnqueueOptions options) {
        Long id;
        if (options.getRunAt() == null) {
            id = jdbcTemplate.queryForObject(INSERT_DUE_NOW, Long.class,
                    type, payloadJson, options.getCriticality().name());
        } else {
            id = jdbcTemplate.queryForObject(INSERT_SCHEDULED, Long.class,
                    type, payloadJson, options.getCriticality().name(), Timestamp.from(options.getRunAt()));
        }
        if (id == null) {
            throw new IllegalStateException("Job insert returned no id");
        }
        return id;
    }

    private String toJson(Object payload) {
        if (payload == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
