package com.flagship.points_ledger.jobs;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable view of a job as claimed by the worker.
 *
 * {@code attempts} already includes the attempt in progress when a handler
 * sees the job.
 */
@Value
@With
public class Job {
    long id;
    String type;
    String payload;
    JobStatus status;
    JobCriticality criticality;
    Instant runAt;
    int attempts;
    String lastError;
    Instant createdAt;
    Instant updatedAt;
}
