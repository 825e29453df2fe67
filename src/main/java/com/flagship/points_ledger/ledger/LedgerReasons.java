package com.flagship.points_ledger.ledger;

/**
 * Reason codes written to {@code ledger_entries.reason}.
 * The set is open; these are the ones the core itself writes or documents.
 */
public final class LedgerReasons {

    public static final String TAP_REWARD = "tap_reward";
    public static final String DAILY_BONUS = "daily_bonus";
    public static final String MISSION_REWARD = "mission_reward";
    public static final String REFERRAL_REWARD = "referral_reward";
    public static final String AD_REWARD = "ad_reward";
    public static final String PURCHASE = "purchase";
    public static final String WITHDRAW_RESERVE = "withdraw_reserve";
    public static final String WITHDRAW_REFUND = "withdraw_refund";

    private LedgerReasons() {
    }
}
