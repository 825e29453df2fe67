package com.flagship.points_ledger.withdraw;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC access to {@code withdraw_requests}.
 *
 * Every state change goes through {@link #lockById(long)} first; the updates
 * themselves do not re-check the status.
 */
@Repository
public class WithdrawRequestStore {

    private static final String COLUMNS = """
            id, account_id, amount, address, status, created_at, reviewed_at, paid_at,
            reject_reason, payout_provider, payout_tx_id, payout_error
            """;

    private final JdbcTemplate jdbcTemplate;

    public WithdrawRequestStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long insert(long accountId, long amount, String address) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO withdraw_requests (account_id, amount, address, status) VALUES (?, ?, ?, 'PENDING') RETURNING id",
            Long.class,
            accountId,
            amount,
            address
        );
        if (id == null) {
            throw new IllegalStateException("Withdraw request insert returned no id");
        }
        return id;
    }

    @Transactional(readOnly = true)
    public Optional<WithdrawRequest> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM withdraw_requests WHERE id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<WithdrawRequest> lockById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM withdraw_requests WHERE id = ? FOR UPDATE", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markApproved(long id) {
        jdbcTemplate.update(
            "UPDATE withdraw_requests SET status = 'APPROVED', reviewed_at = NOW() WHERE id = ?",
            id
        );
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markRejected(long id, String reason) {
        jdbcTemplate.update(
            "UPDATE withdraw_requests SET status = 'REJECTED', reject_reason = ?, reviewed_at = NOW() WHERE id = ?",
            reason,
            id
        );
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markPaid(long id, PayoutResult payout) {
        jdbcTemplate.update(
            "UPDATE withdraw_requests " +
            "SET status = 'PAID', paid_at = NOW(), reviewed_at = COALESCE(reviewed_at, NOW()), " +
            "    payout_provider = ?, payout_tx_id = ?, payout_error = NULL " +
            "WHERE id = ?",
            payout.getProvider(),
            payout.getTxId(),
            id
        );
    }

    /**
     * Records why the last payout attempt failed. Paid or rejected requests
     * are left untouched.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordPayoutError(long id, String error) {
        jdbcTemplate.update(
            "UPDATE withdraw_requests SET payout_error = ? WHERE id = ? AND status = 'APPROVED'",
            error,
            id
        );
    }

    private static RowMapper<WithdrawRequest> rowMapper() {
        return (rs, rowNum) -> new WithdrawRequest(
            rs.getLong("id"),
            rs.getLong("account_id"),
            rs.getLong("amount"),
            rs.getString("address"),
            WithdrawStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            toInstant(rs.getTimestamp("reviewed_at")),
            toInstant(rs.getTimestamp("paid_at")),
            rs.getString("reject_reason"),
            rs.getString("payout_provider"),
            rs.getString("payout_tx_id"),
            rs.getString("payout_error")
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
