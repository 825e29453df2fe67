package com.flagship.points_ledger.withdraw;

/**
 * An outbound payout rail. Called only from the {@code withdraw_payout} job,
 * never on the request path.
 *
 * Jobs are delivered at least once, so a provider may see the same withdraw
 * request more than once. Real rails should use the withdraw id as their own
 * idempotency key.
 */
public interface PayoutProvider {

    /**
     * @throws PermanentPayoutException if the payout can never succeed
     * @throws PayoutException if the payout failed but may succeed on retry
     */
    PayoutResult sendPayout(WithdrawRequest request);
}
