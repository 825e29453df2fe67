package com.flagship.points_ledger.observability;

import com.flagship.points_ledger.jobs.JobRepository;
import com.flagship.points_ledger.jobs.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the job queue.
 *
 * Gauges (refreshed by {@link MetricsScheduler}, not on every scrape):
 * - jobs.backlog.size: pending jobs that are due
 * - jobs.backlog.age.seconds: how long the oldest due job has waited
 * - jobs.failed: jobs in FAILED that need an operator
 *
 * Counters and timers are recorded by the worker and the queue as they go.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobMetrics {

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestDueAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedJobCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("jobs.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of pending jobs that are due")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("jobs.backlog.age.seconds", oldestDueAgeSeconds, AtomicLong::get)
                .description("Age of the oldest due job in seconds")
                .register(meterRegistry);

        Gauge.builder("jobs.failed", failedJobCount, AtomicLong::get)
                .description("Number of jobs that failed permanently or exhausted their attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Job queue metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Instant now = Instant.now();
            long due = jobRepository.countDue(JobStatus.PENDING, now);
            backlogSize.set(due);

            jobRepository.findOldestDueRunAt(JobStatus.PENDING, now)
                    .ifPresentOrElse(
                            oldest -> oldestDueAgeSeconds.set(Math.max(0, Duration.between(oldest, now).getSeconds())),
                            () -> oldestDueAgeSeconds.set(0)
                    );

            long failed = jobRepository.countByStatus(JobStatus.FAILED);
            failedJobCount.set(failed);

            log.debug("Job metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    due, oldestDueAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh job metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public long getFailedJobCount() {
        return failedJobCount.get();
    }

    public void recordJobEnqueued(String type, String criticality) {
        meterRegistry.counter("jobs.enqueued",
                "type", type,
                "status", "success",
                "criticality", criticality
        ).increment();
    }

    public void recordEnqueueFailure(String type, String criticality) {
        meterRegistry.counter("jobs.enqueued",
                "type", type,
                "status", "failure",
                "criticality", criticality
        ).increment();
    }

    /**
     * @param outcome lower-case job outcome, e.g. "completed" or "retry_scheduled"
     */
    public void recordJobProcessed(String type, String outcome, Duration duration) {
        meterRegistry.counter("jobs.processed", "type", type, "outcome", outcome).increment();
        meterRegistry.timer("jobs.duration", "type", type).record(duration);
    }
}
