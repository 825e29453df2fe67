package com.flagship.points_ledger.withdraw;

/**
 * A payout that can never succeed as requested, e.g. an invalid destination
 * address. The payout job fails without retrying.
 */
public class PermanentPayoutException extends PayoutException {

    public PermanentPayoutException(String message) {
        super(message);
    }
}
