package com.flagship.points_ledger.ledger;

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
 * Brings an account's cached balance back in line with its ledger.
 * Safe to run any number of times.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncAccountJobHandler implements JobHandler {

    private final LedgerService ledgerService;
    private final ObjectMapper objectMapper;

    @Override
    public String type() {
        return JobTypes.SYNC_ACCOUNT;
    }

    @Override
    public void handle(Job job) {
        Payload payload = JobPayloads.read(objectMapper, job, Payload.class);
        if (payload.getAccountId() == null || payload.getAccountId() <= 0) {
            throw new NonRetryableJobException("sync_account job missing account_id");
        }

        try {
            ReconciliationResult result = ledgerService.reconcileBalance(payload.getAccountId());
            log.info("sync_account done: accountId={}, corrected={}, balance={}",
                    result.getAccountId(), result.isCorrected(), result.getLedgerBalance());
        } catch (AccountNotFoundException e) {
            throw new NonRetryableJobException("sync_account: account not found: " + payload.getAccountId(), e);
        }
    }

    static class Payload {
        private final Long accountId;

        @JsonCreator
        Payload(@JsonProperty("account_id") @JsonAlias({"accountId", "user_id", "userId"}) Long accountId) {
            this.accountId = accountId;
        }

        Long getAccountId() {
            return accountId;
        }
    }
}
