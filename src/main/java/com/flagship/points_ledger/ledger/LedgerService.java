package com.flagship.points_ledger.ledger;

import com.flagship.points_ledger.jobs.JobQueue;
import com.flagship.points_ledger.jobs.JobTypes;
import com.flagship.points_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The balance mutation engine: the single path through which account
 * balances change.
 *
 * This service enforces the core invariants:
 * 1. Every change writes exactly one ledger entry and moves the cached
 *    balance by the same delta, in one transaction
 * 2. Ledger entries are append-only (also enforced by a database trigger)
 * 3. A change against a missing account fails and leaves nothing behind
 *
 * Non-negative balances are NOT enforced here. A caller that must not
 * overdraw locks the account with {@link AccountService#lockAccount(long)},
 * checks the balance and applies the change in the same transaction.
 *
 * The account row is updated before the entry is inserted. The UPDATE takes
 * the row lock that serializes concurrent changes to one account, and an
 * empty result is how a missing account is detected.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String UPDATE_BALANCE = """
            UPDATE accounts
            SET balance = balance + ?, updated_at = NOW()
            WHERE id = ?
            RETURNING id, balance, created_at
            """;

    private static final String INSERT_ENTRY = """
            INSERT INTO ledger_entries (account_id, delta, reason, ref_type, ref_id, event_type, created_at)
            VALUES (?, ?, ?, ?, ?, ?, NOW())
            RETURNING id
            """;

    private static final String SELECT_ENTRIES = """
            SELECT id, account_id, delta, reason, ref_type, ref_id, event_type, created_at
            FROM ledger_entries
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JobQueue jobQueue;
    private final LedgerMetrics ledgerMetrics;

    public LedgerService(JdbcTemplate jdbcTemplate, JobQueue jobQueue, LedgerMetrics ledgerMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.jobQueue = jobQueue;
        this.ledgerMetrics = ledgerMetrics;
    }

    /**
     * Applies a balance change, joining the caller's transaction if there is
     * one and starting one otherwise.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    @Transactional
    public BalanceChangeResult applyBalanceChange(BalanceChange change) {
        return apply(change);
    }

    /**
     * Applies a balance change as one step of a larger unit of work.
     * Fails unless a transaction is already active, so the change can never
     * commit on its own by accident.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceChangeResult applyBalanceChangeInTransaction(BalanceChange change) {
        return apply(change);
    }

    private BalanceChangeResult apply(BalanceChange change) {
        long startedAt = System.nanoTime();

        List<Account> updated = jdbcTemplate.query(
            UPDATE_BALANCE,
            AccountService.accountRowMapper(),
            change.getDelta(),
            change.getAccountId()
        );
        if (updated.isEmpty()) {
            throw new AccountNotFoundException(change.getAccountId());
        }
        Account account = updated.get(0);

        LedgerReference reference = change.getReference();
        Long entryId = jdbcTemplate.queryForObject(
            INSERT_ENTRY,
            Long.class,
            change.getAccountId(),
            change.getDelta(),
            change.getReason(),
            reference != null ? reference.getCode() : null,
            reference != null ? reference.getId() : null,
            change.effectiveEventType()
        );
        if (entryId == null) {
            throw new IllegalStateException("Ledger insert returned no id");
        }

        log.info("Balance changed: accountId={}, delta={}, reason={}, balance={}, entryId={}",
                account.getId(), change.getDelta(), change.getReason(), account.getBalance(), entryId);
        ledgerMetrics.recordBalanceChange(change.getReason(), change.getDelta(),
                Duration.ofNanos(System.nanoTime() - startedAt));

        return new BalanceChangeResult(account, entryId);
    }

    /**
     * Derives an account's balance from its ledger entries.
     */
    @Transactional(readOnly = true)
    public long getLedgerBalance(long accountId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(delta), 0) FROM ledger_entries WHERE account_id = ?",
            Long.class,
            accountId
        );
        return sum != null ? sum : 0L;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntriesForAccount(long accountId) {
        return jdbcTemplate.query(
            SELECT_ENTRIES + "WHERE account_id = ? ORDER BY id",
            ledgerEntryRowMapper(),
            accountId
        );
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findEntriesByReference(LedgerReference reference) {
        return jdbcTemplate.query(
            SELECT_ENTRIES + "WHERE ref_type = ? AND ref_id = ? ORDER BY id",
            ledgerEntryRowMapper(),
            reference.getCode(),
            reference.getId()
        );
    }

    /**
     * Recomputes an account's balance from the ledger and overwrites the
     * cached balance if the two disagree.
     *
     * Takes the account row lock first, so no change can land between the
     * sum and the correction.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    @Transactional
    public ReconciliationResult reconcileBalance(long accountId) {
        List<Long> locked = jdbcTemplate.queryForList(
            "SELECT balance FROM accounts WHERE id = ? FOR UPDATE",
            Long.class,
            accountId
        );
        if (locked.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        long cached = locked.get(0);
        long fromLedger = getLedgerBalance(accountId);

        if (cached != fromLedger) {
            log.warn("Correcting cached balance from ledger: accountId={}, oldBalance={}, newBalance={}",
                    accountId, cached, fromLedger);
            jdbcTemplate.update(
                "UPDATE accounts SET balance = ?, updated_at = NOW() WHERE id = ?",
                fromLedger,
                accountId
            );
            ledgerMetrics.incrementReconciliationCorrections();
        } else {
            log.debug("Balance consistent with ledger: accountId={}, balance={}", accountId, cached);
        }
        return new ReconciliationResult(accountId, cached, fromLedger);
    }

    /**
     * Schedules a background reconciliation of the account.
     *
     * @return the job id, or null if the job could not be queued
     */
    public Long requestReconciliation(long accountId) {
        return jobQueue.enqueue(JobTypes.SYNC_ACCOUNT, Map.of("account_id", accountId));
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            String refType = rs.getString("ref_type");
            long refId = rs.getLong("ref_id");
            LedgerReference reference = refType != null && !rs.wasNull()
                ? LedgerReference.fromStored(refType, refId)
                : null;
            return new LedgerEntry(
                rs.getLong("id"),
                rs.getLong("account_id"),
                rs.getLong("delta"),
                rs.getString("reason"),
                reference,
                rs.getString("event_type"),
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
