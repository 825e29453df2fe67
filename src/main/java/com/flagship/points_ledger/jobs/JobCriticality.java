package com.flagship.points_ledger.jobs;

/**
 * How an enqueue failure is treated on the request path.
 */
public enum JobCriticality {
    /**
     * Enqueue failures are logged and counted; the caller gets a null job id
     * and its own transaction carries on.
     */
    BEST_EFFORT,
    /**
     * The job is the only path to an externally visible effect. Enqueue
     * failures propagate and roll back the caller's transaction.
     */
    REQUIRED
}
