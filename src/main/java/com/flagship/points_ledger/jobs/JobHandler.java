package com.flagship.points_ledger.jobs;

/**
 * Executes jobs of one type.
 *
 * Implementations are Spring beans collected into the {@link JobHandlerRegistry}
 * at startup. The worker calls {@link #handle(Job)} inside a savepoint of its
 * own transaction, so any writes the handler makes through the shared
 * transaction manager commit together with the job's status, or not at all.
 *
 * Delivery is at least once. A job can be handled, then redelivered because
 * the worker died before committing, so handlers must be idempotent.
 */
public interface JobHandler {

    /**
     * The {@code jobs.type} value this handler serves.
     */
    String type();

    /**
     * Runs the job. Throw {@link NonRetryableJobException} when retrying cannot
     * help; any other runtime exception schedules a retry.
     */
    void handle(Job job);

    /**
     * Called after a failed attempt, once the handler's own writes have been
     * rolled back. Runs in the worker transaction, so anything written here
     * commits with the job's new status.
     *
     * @param terminal true when the job will not be retried
     */
    default void onFailure(Job job, RuntimeException error, boolean terminal) {
    }
}
