package com.flagship.points_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically updates gauge metrics that require database queries,
 * so a Prometheus scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final JobMetrics jobMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshJobMetrics() {
        jobMetrics.refreshMetrics();
    }
}
