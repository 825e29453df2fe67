package com.flagship.points_ledger.jobs;

/**
 * Job type names stored in {@code jobs.type}.
 */
public final class JobTypes {

    public static final String SYNC_ACCOUNT = "sync_account";
    public static final String WITHDRAW_PAYOUT = "withdraw_payout";

    private JobTypes() {
    }
}
