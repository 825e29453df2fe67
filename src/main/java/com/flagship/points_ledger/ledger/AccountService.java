package com.flagship.points_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Account lifecycle and locking.
 *
 * Accounts start at a zero balance (an empty ledger) and are never deleted.
 * Balances change only through {@link LedgerService}.
 */
@Service
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public long createAccount() {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO accounts (balance, created_at, updated_at) VALUES (0, NOW(), NOW()) RETURNING id",
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Account insert returned no id");
        }
        return id;
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(long accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, balance, created_at FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        );
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Account getAccount(long accountId) {
        return findById(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Locks the account row until the caller's transaction ends.
     *
     * This is the guard callers use before a debit that must not overdraw:
     * read the balance here, check it, then apply the change in the same
     * transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account lockAccount(long accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, balance, created_at FROM accounts WHERE id = ? FOR UPDATE",
            accountRowMapper(),
            accountId
        );
        return rows.stream().findFirst().orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getLong("balance"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
