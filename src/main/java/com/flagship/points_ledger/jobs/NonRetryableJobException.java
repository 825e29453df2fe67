package com.flagship.points_ledger.jobs;

/**
 * Thrown by a job handler when the job can never succeed, for example a
 * malformed payload or a referenced entity that does not exist.
 *
 * The worker fails the job immediately instead of retrying it. Any other
 * exception from a handler is treated as transient.
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
