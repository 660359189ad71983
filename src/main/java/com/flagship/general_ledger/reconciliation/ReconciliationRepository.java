package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.journal.Direction;
import com.flagship.general_ledger.journal.PostedLine;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC persistence of reconciliations, their statement transactions and reconciling items.
 *
 * Match and unmatch are guarded updates on match_status; the unique index on
 * matched_journal_line_id keeps a journal line in at most one match.
 */
@Repository
public class ReconciliationRepository {

    private static final RowMapper<Reconciliation> RECONCILIATION_MAPPER = (rs, rowNum) -> Reconciliation.builder()
        .id(rs.getObject("id", UUID.class))
        .bankAccountId(rs.getObject("bank_account_id", UUID.class))
        .fiscalYear(rs.getInt("fiscal_year"))
        .fiscalMonth(rs.getInt("fiscal_month"))
        .statementEndingBalance(rs.getLong("statement_ending_balance"))
        .bookEndingBalance(rs.getLong("book_ending_balance"))
        .adjustedBankBalance(nullableLong(rs, "adjusted_bank_balance"))
        .adjustedBookBalance(nullableLong(rs, "adjusted_book_balance"))
        .status(ReconciliationStatus.valueOf(rs.getString("status")))
        .createdBy(rs.getString("created_by"))
        .completedBy(rs.getString("completed_by"))
        .completedAt(toInstant(rs.getTimestamp("completed_at")))
        .approvedBy(rs.getString("approved_by"))
        .approvedAt(toInstant(rs.getTimestamp("approved_at")))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .build();

    private static final RowMapper<BankTransaction> TRANSACTION_MAPPER = (rs, rowNum) -> new BankTransaction(
        rs.getObject("id", UUID.class),
        rs.getObject("reconciliation_id", UUID.class),
        rs.getLong("sequence_number"),
        rs.getObject("transaction_date", LocalDate.class),
        rs.getString("description"),
        rs.getLong("amount"),
        rs.getString("reference"),
        MatchStatus.valueOf(rs.getString("match_status")),
        rs.getObject("matched_journal_line_id", UUID.class),
        rs.getString("matched_by"),
        toInstant(rs.getTimestamp("matched_at"))
    );

    private static final RowMapper<ReconcilingItem> ITEM_MAPPER = (rs, rowNum) -> ReconcilingItem.builder()
        .id(rs.getObject("id", UUID.class))
        .reconciliationId(rs.getObject("reconciliation_id", UUID.class))
        .itemType(ReconcilingItemType.valueOf(rs.getString("item_type")))
        .description(rs.getString("description"))
        .amount(rs.getLong("amount"))
        .itemDate(rs.getObject("item_date", LocalDate.class))
        .reference(rs.getString("reference"))
        .requiresJournalEntry(rs.getBoolean("requires_journal_entry"))
        .journalEntryId(rs.getObject("journal_entry_id", UUID.class))
        .bankTransactionId(rs.getObject("bank_transaction_id", UUID.class))
        .createdBy(rs.getString("created_by"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .build();

    private static final RowMapper<PostedLine> CANDIDATE_MAPPER = (rs, rowNum) -> new PostedLine(
        rs.getObject("id", UUID.class),
        rs.getObject("entry_id", UUID.class),
        rs.getString("entry_number"),
        rs.getObject("entry_date", LocalDate.class),
        rs.getInt("line_number"),
        rs.getObject("account_id", UUID.class),
        Direction.valueOf(rs.getString("direction")),
        rs.getLong("amount"),
        rs.getString("memo")
    );

    private final JdbcTemplate jdbcTemplate;

    public ReconciliationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Reconciliation reconciliation) {
        jdbcTemplate.update(
            "INSERT INTO reconciliations (id, bank_account_id, fiscal_year, fiscal_month, statement_ending_balance, " +
            "book_ending_balance, status, created_by, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            reconciliation.getId(),
            reconciliation.getBankAccountId(),
            reconciliation.getFiscalYear(),
            reconciliation.getFiscalMonth(),
            reconciliation.getStatementEndingBalance(),
            reconciliation.getBookEndingBalance(),
            reconciliation.getStatus().name(),
            reconciliation.getCreatedBy(),
            Timestamp.from(reconciliation.getCreatedAt()),
            Timestamp.from(reconciliation.getCreatedAt()));
    }

    /**
     * Writes the mutable columns: status, adjusted balances and the completion/approval stamps.
     */
    public void update(Reconciliation reconciliation) {
        jdbcTemplate.update(
            "UPDATE reconciliations SET status = ?, adjusted_bank_balance = ?, adjusted_book_balance = ?, " +
            "completed_by = ?, completed_at = ?, approved_by = ?, approved_at = ?, updated_at = ? WHERE id = ?",
            reconciliation.getStatus().name(),
            reconciliation.getAdjustedBankBalance(),
            reconciliation.getAdjustedBookBalance(),
            reconciliation.getCompletedBy(),
            toTimestamp(reconciliation.getCompletedAt()),
            reconciliation.getApprovedBy(),
            toTimestamp(reconciliation.getApprovedAt()),
            Timestamp.from(Instant.now()),
            reconciliation.getId());
    }

    public Optional<Reconciliation> findById(UUID reconciliationId) {
        return jdbcTemplate.query("SELECT * FROM reconciliations WHERE id = ?", RECONCILIATION_MAPPER, reconciliationId)
            .stream().findFirst();
    }

    /**
     * Locks the reconciliation row until the current transaction ends.
     */
    public Optional<Reconciliation> findByIdForUpdate(UUID reconciliationId) {
        return jdbcTemplate.query("SELECT * FROM reconciliations WHERE id = ? FOR UPDATE",
            RECONCILIATION_MAPPER, reconciliationId).stream().findFirst();
    }

    public boolean existsForPeriod(UUID bankAccountId, int fiscalYear, int fiscalMonth) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM reconciliations WHERE bank_account_id = ? AND fiscal_year = ? AND fiscal_month = ?)",
            Boolean.class, bankAccountId, fiscalYear, fiscalMonth);
        return Boolean.TRUE.equals(exists);
    }

    public List<Reconciliation> findByBankAccount(UUID bankAccountId) {
        return jdbcTemplate.query(
            "SELECT * FROM reconciliations WHERE bank_account_id = ? ORDER BY fiscal_year, fiscal_month",
            RECONCILIATION_MAPPER, bankAccountId);
    }

    /**
     * Inserts one statement line unless the same (date, amount, reference) is already there.
     *
     * @return 1 if inserted, 0 if skipped as a duplicate
     */
    public int insertTransaction(UUID reconciliationId, StatementLine line) {
        return jdbcTemplate.update(
            "INSERT INTO bank_transactions (id, reconciliation_id, transaction_date, description, amount, reference) " +
            "VALUES (?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (reconciliation_id, transaction_date, amount, reference) DO NOTHING",
            UUID.randomUUID(),
            reconciliationId,
            line.getTransactionDate(),
            line.getDescription(),
            line.getAmount(),
            line.normalizedReference());
    }

    /**
     * Transactions in statement order: date, then import order.
     */
    public List<BankTransaction> findTransactions(UUID reconciliationId) {
        return jdbcTemplate.query(
            "SELECT * FROM bank_transactions WHERE reconciliation_id = ? ORDER BY transaction_date, sequence_number",
            TRANSACTION_MAPPER, reconciliationId);
    }

    public Optional<BankTransaction> findTransaction(UUID reconciliationId, UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT * FROM bank_transactions WHERE id = ? AND reconciliation_id = ?",
            TRANSACTION_MAPPER, transactionId, reconciliationId).stream().findFirst();
    }

    /**
     * @return 1 if the transaction was UNMATCHED and is now matched to the line, 0 otherwise
     * @throws org.springframework.dao.DuplicateKeyException if the line is matched elsewhere
     */
    public int markMatched(UUID transactionId, UUID journalLineId, String matchedBy, Instant matchedAt) {
        return jdbcTemplate.update(
            "UPDATE bank_transactions SET match_status = 'MATCHED', matched_journal_line_id = ?, " +
            "matched_by = ?, matched_at = ? WHERE id = ? AND match_status = 'UNMATCHED'",
            journalLineId, matchedBy, Timestamp.from(matchedAt), transactionId);
    }

    /**
     * @return 1 if the transaction was MATCHED and is now UNMATCHED, 0 otherwise
     */
    public int markUnmatched(UUID transactionId) {
        return jdbcTemplate.update(
            "UPDATE bank_transactions SET match_status = 'UNMATCHED', matched_journal_line_id = NULL, " +
            "matched_by = NULL, matched_at = NULL WHERE id = ? AND match_status = 'MATCHED'",
            transactionId);
    }

    public boolean isJournalLineMatched(UUID journalLineId) {
        Boolean matched = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM bank_transactions WHERE matched_journal_line_id = ?)",
            Boolean.class, journalLineId);
        return Boolean.TRUE.equals(matched);
    }

    /**
     * Posted lines on the GL account dated within [fromDate, toDate] that no bank
     * transaction has matched, in (date, entry number, line number) order.
     */
    public List<PostedLine> findUnmatchedPostedLines(UUID accountId, LocalDate fromDate, LocalDate toDate) {
        return jdbcTemplate.query(
            "SELECT l.*, e.entry_number, e.entry_date FROM journal_lines l " +
            "JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.account_id = ? AND e.status = 'POSTED' AND e.entry_date BETWEEN ? AND ? " +
            "AND NOT EXISTS (SELECT 1 FROM bank_transactions bt WHERE bt.matched_journal_line_id = l.id) " +
            "ORDER BY e.entry_date, e.entry_number, l.line_number",
            CANDIDATE_MAPPER, accountId, fromDate, toDate);
    }

    public void insertItem(ReconcilingItem item) {
        jdbcTemplate.update(
            "INSERT INTO reconciling_items (id, reconciliation_id, item_type, description, amount, item_date, " +
            "reference, requires_journal_entry, journal_entry_id, bank_transaction_id, created_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            item.getId(),
            item.getReconciliationId(),
            item.getItemType().name(),
            item.getDescription(),
            item.getAmount(),
            item.getItemDate(),
            item.getReference(),
            item.isRequiresJournalEntry(),
            item.getJournalEntryId(),
            item.getBankTransactionId(),
            item.getCreatedBy(),
            Timestamp.from(item.getCreatedAt()));
    }

    public List<ReconcilingItem> findItems(UUID reconciliationId) {
        return jdbcTemplate.query(
            "SELECT * FROM reconciling_items WHERE reconciliation_id = ? ORDER BY item_date, created_at",
            ITEM_MAPPER, reconciliationId);
    }

    public boolean isTransactionAccepted(UUID transactionId) {
        Boolean accepted = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM reconciling_items WHERE bank_transaction_id = ?)",
            Boolean.class, transactionId);
        return Boolean.TRUE.equals(accepted);
    }

    public void linkItemToEntry(UUID itemId, UUID journalEntryId) {
        jdbcTemplate.update("UPDATE reconciling_items SET journal_entry_id = ? WHERE id = ?", journalEntryId, itemId);
    }

    /**
     * Transactions that are neither matched nor accepted by a reconciling item.
     */
    public int countUnresolvedTransactions(UUID reconciliationId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM bank_transactions bt WHERE bt.reconciliation_id = ? " +
            "AND bt.match_status = 'UNMATCHED' " +
            "AND NOT EXISTS (SELECT 1 FROM reconciling_items ri WHERE ri.bank_transaction_id = bt.id)",
            Integer.class, reconciliationId);
        return count != null ? count : 0;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
