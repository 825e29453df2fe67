package com.flagship.points_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Balance ledger core for the tap-to-earn mini-app backend.
 *
 * The same artifact serves the request tier (ledger, idempotency gate, enqueue)
 * and the worker tier (job polling), selected by {@code jobs.worker.enabled}.
 */
@SpringBootApplication
@EnableScheduling
public class PointsLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PointsLedgerApplication.class, args);
    }
}
