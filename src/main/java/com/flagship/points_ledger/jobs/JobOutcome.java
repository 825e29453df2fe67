package com.flagship.points_ledger.jobs;

import lombok.Value;

/**
 * What one worker iteration did with the job it claimed.
 */
@Value
public class JobOutcome {

    public enum Disposition {
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        SKIPPED_UNKNOWN_TYPE,
        /** The lease expired and another worker reclaimed the job; this run's writes were discarded. */
        CLAIM_LOST
    }

    long jobId;
    String type;
    int attempts;
    Disposition disposition;
    String error;
}
