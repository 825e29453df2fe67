package com.flagship.points_ledger.jobs;

/**
 * A {@link JobCriticality#REQUIRED} job could not be written.
 * The caller's transaction must not commit without it.
 */
public class JobEnqueueException extends RuntimeException {

    public JobEnqueueException(String type, Throwable cause) {
        super("Failed to enqueue required job of type " + type, cause);
    }
}
