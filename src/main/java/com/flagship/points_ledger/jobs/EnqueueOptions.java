package com.flagship.points_ledger.jobs;

import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Objects;

/**
 * Options for {@link JobQueue#enqueue(String, Object, EnqueueOptions)}.
 * A null {@code runAt} means "due now" by the database clock.
 */
@Value
@With
public class EnqueueOptions {
    Instant runAt;
    JobCriticality criticality;

    public EnqueueOptions(Instant runAt, JobCriticality criticality) {
        this.runAt = runAt;
        this.criticality = Objects.requireNonNull(criticality, "criticality is required");
    }

    public static EnqueueOptions bestEffort() {
        return new EnqueueOptions(null, JobCriticality.BEST_EFFORT);
    }

    public static EnqueueOptions required() {
        return new EnqueueOptions(null, JobCriticality.REQUIRED);
    }
}
