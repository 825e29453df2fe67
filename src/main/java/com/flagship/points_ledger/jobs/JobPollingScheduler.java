package com.flagship.points_ledger.jobs;

import com.flagship.points_ledger.config.AppSettingsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The worker's poll loop.
 *
 * Single-threaded per process: Spring's fixed delay waits for one drain to
 * finish before sleeping. Run more processes to scale out; the claim query
 * keeps them apart. Operators can pause polling with the {@code jobs_paused}
 * app setting.
 */
@Component
@ConditionalOnProperty(name = "jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JobPollingScheduler {

    static final String JOBS_PAUSED_SETTING = "jobs_paused";

    private final JobWorker jobWorker;
    private final AppSettingsCache appSettings;

    @Value("${jobs.worker.batch-limit:50}")
    private int batchLimit;

    @Scheduled(fixedDelayString = "${jobs.worker.poll-interval-ms:2000}")
    public void pollJobs() {
        try {
            if (appSettings.getBoolean(JOBS_PAUSED_SETTING, false)) {
                log.debug("Job polling paused by app setting {}", JOBS_PAUSED_SETTING);
                return;
            }
            jobWorker.drainDueJobs(batchLimit);
        } catch (Exception e) {
            log.error("Error in job polling loop", e);
        }
    }
}
