package com.flagship.general_ledger.balance;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to account_balances and the posted-line aggregates they are built from.
 */
@Repository
public class AccountBalanceRepository {

    private static final RowMapper<AccountBalance> BALANCE_MAPPER = (rs, rowNum) -> new AccountBalance(
        rs.getObject("account_id", UUID.class),
        rs.getInt("fiscal_year"),
        rs.getInt("fiscal_month"),
        rs.getLong("opening_balance"),
        rs.getLong("debit_total"),
        rs.getLong("credit_total"),
        rs.getLong("closing_balance"),
        rs.getTimestamp("calculated_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public AccountBalanceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Debit and credit totals of POSTED entries in the period, per account.
     * DRAFT and VOIDED entries are excluded.
     */
    public Map<UUID, AccountLineTotals> sumPostedLines(int fiscalYear, int fiscalMonth) {
        Map<UUID, AccountLineTotals> totals = new HashMap<>();
        jdbcTemplate.query(
            "SELECT l.account_id, " +
            "  COALESCE(SUM(CASE WHEN l.direction = 'DEBIT' THEN l.amount ELSE 0 END), 0) AS debit_total, " +
            "  COALESCE(SUM(CASE WHEN l.direction = 'CREDIT' THEN l.amount ELSE 0 END), 0) AS credit_total " +
            "FROM journal_lines l " +
            "JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE e.status = 'POSTED' AND e.fiscal_year = ? AND e.fiscal_month = ? " +
            "GROUP BY l.account_id",
            rs -> {
                UUID accountId = rs.getObject("account_id", UUID.class);
                totals.put(accountId, new AccountLineTotals(
                    accountId, rs.getLong("debit_total"), rs.getLong("credit_total")));
            },
            fiscalYear, fiscalMonth);
        return totals;
    }

    /**
     * Cumulative posted debits minus credits on an account up to and including a date.
     */
    public long netPostedThrough(UUID accountId, LocalDate asOf) {
        Long net = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN l.direction = 'DEBIT' THEN l.amount ELSE -l.amount END), 0) " +
            "FROM journal_lines l " +
            "JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE e.status = 'POSTED' AND l.account_id = ? AND e.entry_date <= ?",
            Long.class,
            accountId, asOf);
        return net != null ? net : 0L;
    }

    public Map<UUID, Long> findClosingBalances(int fiscalYear, int fiscalMonth) {
        Map<UUID, Long> closings = new HashMap<>();
        jdbcTemplate.query(
            "SELECT account_id, closing_balance FROM account_balances WHERE fiscal_year = ? AND fiscal_month = ?",
            rs -> {
                closings.put(rs.getObject("account_id", UUID.class), rs.getLong("closing_balance"));
            },
            fiscalYear, fiscalMonth);
        return closings;
    }

    public List<AccountBalance> findByPeriod(int fiscalYear, int fiscalMonth) {
        return jdbcTemplate.query(
            "SELECT * FROM account_balances WHERE fiscal_year = ? AND fiscal_month = ? ORDER BY account_id",
            BALANCE_MAPPER,
            fiscalYear, fiscalMonth);
    }

    public Optional<AccountBalance> find(UUID accountId, int fiscalYear, int fiscalMonth) {
        return jdbcTemplate.query(
            "SELECT * FROM account_balances WHERE account_id = ? AND fiscal_year = ? AND fiscal_month = ?",
            BALANCE_MAPPER,
            accountId, fiscalYear, fiscalMonth
        ).stream().findFirst();
    }

    /**
     * Writes each balance as a whole row; an existing row for the same key is replaced entirely.
     */
    public void upsertAll(List<AccountBalance> balances) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO account_balances " +
            "(account_id, fiscal_year, fiscal_month, opening_balance, debit_total, credit_total, closing_balance, calculated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (account_id, fiscal_year, fiscal_month) DO UPDATE SET " +
            "opening_balance = EXCLUDED.opening_balance, " +
            "debit_total = EXCLUDED.debit_total, " +
            "credit_total = EXCLUDED.credit_total, " +
            "closing_balance = EXCLUDED.closing_balance, " +
            "calculated_at = EXCLUDED.calculated_at",
            balances,
            100,
            (ps, balance) -> {
                ps.setObject(1, balance.getAccountId());
                ps.setInt(2, balance.getFiscalYear());
                ps.setInt(3, balance.getFiscalMonth());
                ps.setLong(4, balance.getOpeningBalance());
                ps.setLong(5, balance.getDebitTotal());
                ps.setLong(6, balance.getCreditTotal());
                ps.setLong(7, balance.getClosingBalance());
                ps.setTimestamp(8, Timestamp.from(balance.getCalculatedAt()));
            });
    }
}
