package com.flagship.points_ledger.observability;

import com.flagship.points_ledger.jobs.JobRepository;
import com.flagship.points_ledger.jobs.JobStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Custom health indicators for the ledger service, exposed through
 * {@code /actuator/health}.
 */
public class HealthIndicators {

    /**
     * Reports the due-job backlog and stuck jobs. A growing backlog means
     * workers are down or cannot keep up; a stuck job was abandoned by a
     * worker or is overdue. Either one raises WARNING.
     */
    @Component("jobQueueHealth")
    public static class JobQueueHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final JobRepository jobRepository;

        public JobQueueHealthIndicator(JobRepository jobRepository) {
            this.jobRepository = jobRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = jobRepository.countDue(JobStatus.PENDING, Instant.now());
                long failed = jobRepository.countByStatus(JobStatus.FAILED);
                long stuck = jobRepository.countStuck();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD && stuck == 0
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("failedJobs", failed)
                        .withDetail("stuckJobs", stuck)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so losing it degrades the
     * service instead of taking it down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.status("DEGRADED")
                            .withDetail("response", result != null ? result : "null")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
