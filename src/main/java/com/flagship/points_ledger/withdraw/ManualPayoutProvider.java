package com.flagship.points_ledger.withdraw;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Payout rail for withdrawals settled by hand.
 *
 * Nothing is sent anywhere; the request is recorded as paid with a
 * {@code manual-<id>} reference that an operator replaces once the real
 * transfer is made. Addresses are still checked for a plausible shape, so
 * obvious garbage fails here rather than at the operator's desk.
 */
@Component
@ConditionalOnProperty(name = "payout.provider", havingValue = "manual", matchIfMissing = true)
@Slf4j
public class ManualPayoutProvider implements PayoutProvider {

    static final String PROVIDER = "manual";

    private static final Pattern ADDRESS = Pattern.compile("^[A-Za-z0-9_\\-:+/=]{8,128}$");

    @Override
    public PayoutResult sendPayout(WithdrawRequest request) {
        if (request.getAddress() == null || !ADDRESS.matcher(request.getAddress()).matches()) {
            throw new PermanentPayoutException("Invalid payout address for withdraw request " + request.getId());
        }

        String txId = PROVIDER + "-" + request.getId();
        log.info("Manual payout recorded: withdrawId={}, accountId={}, amount={}, txId={}",
                request.getId(), request.getAccountId(), request.getAmount(), txId);
        return new PayoutResult(PROVIDER, txId);
    }
}
