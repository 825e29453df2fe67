package com.flagship.points_ledger.jobs;

/**
 * Lifecycle of a job row.
 *
 * PROCESSING means a worker holds the job until {@code locked_until}. A
 * PROCESSING job whose lease has expired is claimed again.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
