package com.flagship.points_ledger.withdraw;

/**
 * A payout attempt failed in a way that may succeed later
 * (timeout, provider unavailable).
 */
public class PayoutException extends RuntimeException {

    public PayoutException(String message) {
        super(message);
    }

    public PayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
