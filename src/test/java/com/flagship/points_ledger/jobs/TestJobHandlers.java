package com.flagship.points_ledger.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.points_ledger.ledger.BalanceChange;
import com.flagship.points_ledger.ledger.LedgerService;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job handlers used only by tests.
 */
@TestConfiguration
public class TestJobHandlers {

    public static final String CREDIT = "test_credit";
    public static final String FAIL_PERMANENT = "test_fail_permanent";
    public static final String FAIL_TRANSIENT = "test_fail_transient";
    public static final String PARTIAL_WRITE = "test_partial_write";
    public static final String COUNT = "test_count";
    public static final String SLOW = "test_slow";
    public static final String RECLAIMED_MID_RUN = "test_reclaimed_mid_run";

    /** Longer than the one-second transaction timeout used with {@link #SLOW}. */
    public static final long SLOW_HANDLER_MS = 1500;

    /**
     * How many times each job id was handled.
     */
    public static class Executions {
        private final Map<Long, AtomicInteger> byJobId = new ConcurrentHashMap<>();

        void record(long jobId) {
            byJobId.computeIfAbsent(jobId, id -> new AtomicInteger()).incrementAndGet();
        }

        public Map<Long, AtomicInteger> snapshot() {
            return Map.copyOf(byJobId);
        }

        public void clear() {
            byJobId.clear();
        }
    }

    @Bean
    Executions executions() {
        return new Executions();
    }

    @Bean
    JobHandler creditHandler(LedgerService ledgerService, ObjectMapper objectMapper) {
        return new JobHandler() {
            @Override
            public String type() {
                return CREDIT;
            }

            @Override
            public void handle(Job job) {
                ledgerService.applyBalanceChange(BalanceChange.credit(accountId(objectMapper, job), 10, "test_credit"));
            }
        };
    }

    @Bean
    JobHandler failPermanentHandler() {
        return new JobHandler() {
            @Override
            public String type() {
                return FAIL_PERMANENT;
            }

            @Override
            public void handle(Job job) {
                throw new NonRetryableJobException("payload can never succeed");
            }
        };
    }

    @Bean
    JobHandler failTransientHandler() {
        return new JobHandler() {
            @Override
            public String type() {
                return FAIL_TRANSIENT;
            }

            @Override
            public void handle(Job job) {
                throw new IllegalStateException("provider timed out");
            }
        };
    }

    @Bean
    JobHandler partialWriteHandler(LedgerService ledgerService, ObjectMapper objectMapper) {
        return new JobHandler() {
            @Override
            public String type() {
                return PARTIAL_WRITE;
            }

            @Override
            public void handle(Job job) {
                ledgerService.applyBalanceChange(BalanceChange.credit(accountId(objectMapper, job), 10, "test_credit"));
                throw new IllegalStateException("failed after writing");
            }
        };
    }

    @Bean
    JobHandler countingHandler(Executions executions) {
        return new JobHandler() {
            @Override
            public String type() {
                return COUNT;
            }

            @Override
            public void handle(Job job) {
                executions.record(job.getId());
            }
        };
    }

    @Bean
    JobHandler slowHandler(JdbcTemplate jdbcTemplate) {
        return new JobHandler() {
            @Override
            public String type() {
                return SLOW;
            }

            @Override
            public void handle(Job job) {
                try {
                    Thread.sleep(SLOW_HANDLER_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
                jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            }
        };
    }

    /**
     * Writes a credit, but while it runs another worker takes the job over,
     * as if this worker's lease had expired.
     */
    @Bean
    JobHandler reclaimedMidRunHandler(LedgerService ledgerService, ObjectMapper objectMapper, JdbcTemplate jdbcTemplate) {
        return new JobHandler() {
            @Override
            public String type() {
                return RECLAIMED_MID_RUN;
            }

            @Override
            public void handle(Job job) {
                ledgerService.applyBalanceChange(BalanceChange.credit(accountId(objectMapper, job), 10, "test_credit"));
                // Outside this transaction, like a second worker's claim.
                CompletableFuture.runAsync(() -> jdbcTemplate.update(
                    "UPDATE jobs SET attempts = attempts + 1, locked_until = NOW() + INTERVAL '1 minute' WHERE id = ?",
                    job.getId())).join();
            }
        };
    }

    private static long accountId(ObjectMapper objectMapper, Job job) {
        try {
            JsonNode payload = objectMapper.readTree(job.getPayload());
            return payload.path("account_id").asLong();
        } catch (Exception e) {
            throw new NonRetryableJobException("bad test payload", e);
        }
    }
}
