package com.flagship.points_ledger.withdraw;

import com.flagship.points_ledger.config.AppSettingsCache;
import com.flagship.points_ledger.idempotency.IdempotencyKeyDescriptor;
import com.flagship.points_ledger.idempotency.IdempotentOperationExecutor;
import com.flagship.points_ledger.idempotency.IdempotentResult;
import com.flagship.points_ledger.jobs.EnqueueOptions;
import com.flagship.points_ledger.jobs.JobQueue;
import com.flagship.points_ledger.jobs.JobTypes;
import com.flagship.points_ledger.ledger.Account;
import com.flagship.points_ledger.ledger.AccountService;
import com.flagship.points_ledger.ledger.BalanceChange;
import com.flagship.points_ledger.ledger.BalanceChangeResult;
import com.flagship.points_ledger.ledger.InsufficientBalanceException;
import com.flagship.points_ledger.ledger.LedgerReasons;
import com.flagship.points_ledger.ledger.LedgerReference;
import com.flagship.points_ledger.ledger.LedgerService;
import com.flagship.points_ledger.observability.CorrelationContext;
import com.flagship.points_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Withdrawal lifecycle.
 *
 * - Request: reserves the amount from the balance (a {@code withdraw_reserve}
 *   debit) and records a PENDING request, once per client request id.
 * - Approve: moves the request to APPROVED and queues the payout job in the
 *   same transaction. The payout job is REQUIRED: an approval that cannot
 *   queue its payout is rolled back rather than left stranded.
 * - Reject: moves the request to REJECTED and refunds the reservation.
 * - Payout: done asynchronously by {@link WithdrawPayoutJobHandler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawService {

    static final String REQUEST_ENDPOINT = "withdraw.request";
    static final String MIN_AMOUNT_SETTING = "withdraw_min_amount";

    private final WithdrawRequestStore withdrawRequestStore;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final IdempotentOperationExecutor idempotentExecutor;
    private final JobQueue jobQueue;
    private final AppSettingsCache appSettings;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Submits a withdrawal.
     *
     * @throws IllegalArgumentException if the amount is below the configured minimum
     * @throws InsufficientBalanceException if the balance does not cover the amount
     * @throws com.flagship.points_ledger.ledger.AccountNotFoundException if the account does not exist
     */
    public IdempotentResult<WithdrawReceipt> requestWithdraw(WithdrawCommand command) {
        long minAmount = appSettings.getLong(MIN_AMOUNT_SETTING, 1L);
        if (command.getAmount() < minAmount) {
            throw new IllegalArgumentException(String.format(
                    "Withdraw amount %d is below the minimum of %d", command.getAmount(), minAmount));
        }

        IdempotencyKeyDescriptor key = IdempotencyKeyDescriptor.forAccount(
                REQUEST_ENDPOINT, command.getRequestId(), command.getAccountId());

        try (CorrelationContext.Scope accountScope =
                     CorrelationContext.with(CorrelationContext.ACCOUNT_ID_MDC_KEY, command.getAccountId())) {
            return idempotentExecutor.execute(key, WithdrawReceipt.class, () -> reserve(command));
        }
    }

    private WithdrawReceipt reserve(WithdrawCommand command) {
        // Check and debit under the account lock so concurrent requests cannot both pass.
        Account account = accountService.lockAccount(command.getAccountId());
        if (account.getBalance() < command.getAmount()) {
            throw new InsufficientBalanceException(account.getId(), account.getBalance(), command.getAmount());
        }

        long withdrawId = withdrawRequestStore.insert(command.getAccountId(), command.getAmount(), command.getAddress());
        BalanceChangeResult change = ledgerService.applyBalanceChangeInTransaction(BalanceChange.builder()
                .accountId(command.getAccountId())
                .delta(-command.getAmount())
                .reason(LedgerReasons.WITHDRAW_RESERVE)
                .reference(LedgerReference.withdrawRequest(withdrawId))
                .build());

        log.info("Withdraw requested: withdrawId={}, accountId={}, amount={}, balance={}",
                withdrawId, command.getAccountId(), command.getAmount(), change.getAccount().getBalance());
        ledgerMetrics.recordWithdrawTransition(WithdrawStatus.PENDING.name());
        return new WithdrawReceipt(withdrawId, command.getAmount(), change.getAccount().getBalance(), WithdrawStatus.PENDING);
    }

    /**
     * Approves a pending request and queues its payout. Approving an approved
     * or paid request changes nothing.
     *
     * @throws WithdrawRequestNotFoundException if the request does not exist
     * @throws IllegalStateException if the request was rejected
     * @throws com.flagship.points_ledger.jobs.JobEnqueueException if the payout job cannot be queued
     */
    @Transactional
    public WithdrawRequest approveWithdraw(long withdrawId) {
        WithdrawRequest request = withdrawRequestStore.lockById(withdrawId)
                .orElseThrow(() -> new WithdrawRequestNotFoundException(withdrawId));

        switch (request.getStatus()) {
            case APPROVED, PAID -> {
                log.info("Withdraw already {}, nothing to approve: withdrawId={}", request.getStatus(), withdrawId);
                return request;
            }
            case REJECTED -> throw new IllegalStateException("Withdraw request " + withdrawId + " was rejected");
            case PENDING -> {
                withdrawRequestStore.markApproved(withdrawId);
                Long jobId = jobQueue.enqueue(JobTypes.WITHDRAW_PAYOUT,
                        Map.of("withdraw_id", withdrawId), EnqueueOptions.required());
                log.info("Withdraw approved: withdrawId={}, payoutJobId={}", withdrawId, jobId);
                ledgerMetrics.recordWithdrawTransition(WithdrawStatus.APPROVED.name());
                return reload(withdrawId);
            }
            default -> throw new IllegalStateException("Unexpected withdraw status " + request.getStatus());
        }
    }

    /**
     * Rejects a request that has not been paid and refunds its reservation.
     * Rejecting a rejected request changes nothing.
     *
     * @throws WithdrawRequestNotFoundException if the request does not exist
     * @throws IllegalStateException if the request was already paid
     */
    @Transactional
    public WithdrawRequest rejectWithdraw(long withdrawId, String reason) {
        WithdrawRequest request = withdrawRequestStore.lockById(withdrawId)
                .orElseThrow(() -> new WithdrawRequestNotFoundException(withdrawId));

        switch (request.getStatus()) {
            case REJECTED -> {
                log.info("Withdraw already rejected: withdrawId={}", withdrawId);
                return request;
            }
            case PAID -> throw new IllegalStateException("Withdraw request " + withdrawId + " was already paid");
            case PENDING, APPROVED -> {
                withdrawRequestStore.markRejected(withdrawId, reason);
                ledgerService.applyBalanceChangeInTransaction(BalanceChange.builder()
                        .accountId(request.getAccountId())
                        .delta(request.getAmount())
                        .reason(LedgerReasons.WITHDRAW_REFUND)
                        .reference(LedgerReference.withdrawRequest(withdrawId))
                        .build());
                log.info("Withdraw rejected and refunded: withdrawId={}, accountId={}, amount={}",
                        withdrawId, request.getAccountId(), request.getAmount());
                ledgerMetrics.recordWithdrawTransition(WithdrawStatus.REJECTED.name());
                return reload(withdrawId);
            }
            default -> throw new IllegalStateException("Unexpected withdraw status " + request.getStatus());
        }
    }

    public Optional<WithdrawRequest> findById(long withdrawId) {
        return withdrawRequestStore.findById(withdrawId);
    }

    private WithdrawRequest reload(long withdrawId) {
        return withdrawRequestStore.findById(withdrawId)
                .orElseThrow(() -> new WithdrawRequestNotFoundException(withdrawId));
    }
}
