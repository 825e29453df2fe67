package com.flagship.points_ledger.withdraw;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.points_ledger.jobs.Job;
import com.flagship.points_ledger.jobs.JobHandler;
import com.flagship.points_ledger.jobs.JobPayloads;
import com.flagship.points_ledger.jobs.JobTypes;
import com.flagship.points_ledger.jobs.NonRetryableJobException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pays out an approved withdrawal.
 *
 * The points were reserved when the request was made, so this handler never
 * touches the ledger. It locks the request, skips it unless it is APPROVED,
 * calls the payout provider and records the provider's reference.
 *
 * A crash after the provider call but before commit leaves the request
 * APPROVED, and the retry calls the provider again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WithdrawPayoutJobHandler implements JobHandler {

    private final WithdrawRequestStore withdrawRequestStore;
    private final PayoutProvider payoutProvider;
    private final ObjectMapper objectMapper;

    @Override
    public String type() {
        return JobTypes.WITHDRAW_PAYOUT;
    }

    @Override
    public void handle(Job job) {
        long withdrawId = withdrawId(job);

        WithdrawRequest request = withdrawRequestStore.lockById(withdrawId)
                .orElseThrow(() -> new NonRetryableJobException("withdraw_payout: withdraw request not found: " + withdrawId));

        if (request.getStatus().isFinal()) {
            log.info("withdraw_payout: request already {}, skipping: withdrawId={}", request.getStatus(), withdrawId);
            return;
        }
        if (request.getStatus() != WithdrawStatus.APPROVED) {
            log.info("withdraw_payout: request not approved ({}), skipping: withdrawId={}", request.getStatus(), withdrawId);
            return;
        }

        PayoutResult payout;
        try {
            payout = payoutProvider.sendPayout(request);
        } catch (PermanentPayoutException e) {
            throw new NonRetryableJobException("withdraw_payout: " + e.getMessage(), e);
        }

        withdrawRequestStore.markPaid(withdrawId, payout);
        log.info("Withdraw paid: withdrawId={}, provider={}, txId={}", withdrawId, payout.getProvider(), payout.getTxId());
    }

    @Override
    public void onFailure(Job job, RuntimeException error, boolean terminal) {
        long withdrawId;
        try {
            withdrawId = withdrawId(job);
        } catch (NonRetryableJobException e) {
            log.debug("withdraw_payout: no request to annotate for job {}: {}", job.getId(), e.getMessage());
            return;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        withdrawRequestStore.recordPayoutError(withdrawId, message);
    }

    private long withdrawId(Job job) {
        Payload payload = JobPayloads.read(objectMapper, job, Payload.class);
        if (payload.getWithdrawId() == null || payload.getWithdrawId() <= 0) {
            throw new NonRetryableJobException("withdraw_payout job missing withdraw_id");
        }
        return payload.getWithdrawId();
    }

    static class Payload {
        private final Long withdrawId;

        @JsonCreator
        Payload(@JsonProperty("withdraw_id") @JsonAlias("withdrawId") Long withdrawId) {
            this.withdrawId = withdrawId;
        }

        Long getWithdrawId() {
            return withdrawId;
        }
    }
}
