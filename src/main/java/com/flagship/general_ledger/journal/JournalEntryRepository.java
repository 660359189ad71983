package com.flagship.general_ledger.journal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JDBC persistence of journal entries and lines.
 *
 * Status changes are guarded updates ({@code WHERE status = ?}): the caller
 * learns from the row count whether it won the transition, so two concurrent
 * posts of the same draft cannot both succeed.
 */
@Repository
public class JournalEntryRepository {

    private static final RowMapper<JournalLine> LINE_MAPPER = (rs, rowNum) -> new JournalLine(
        rs.getObject("id", UUID.class),
        rs.getObject("entry_id", UUID.class),
        rs.getInt("line_number"),
        rs.getObject("account_id", UUID.class),
        Direction.valueOf(rs.getString("direction")),
        rs.getLong("amount"),
        rs.getString("memo")
    );

    private static final RowMapper<PostedLine> POSTED_LINE_MAPPER = (rs, rowNum) -> new PostedLine(
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

    public JournalEntryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long nextEntrySequence() {
        Long next = jdbcTemplate.queryForObject("SELECT nextval('journal_entry_number_seq')", Long.class);
        if (next == null) {
            throw new IllegalStateException("Entry number sequence returned no value");
        }
        return next;
    }

    /**
     * Inserts a DRAFT entry and all its lines. The balance trigger re-checks the lines at commit.
     */
    public void insert(JournalEntry entry, String idempotencyKey) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, entry_number, entry_date, fiscal_year, fiscal_month, description, " +
            "reference, entry_type, status, created_by, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getEntryNumber(),
            entry.getEntryDate(),
            entry.getFiscalYear(),
            entry.getFiscalMonth(),
            entry.getDescription(),
            entry.getReference(),
            entry.getEntryType().name(),
            entry.getStatus().name(),
            entry.getCreatedBy(),
            idempotencyKey,
            Timestamp.from(entry.getCreatedAt())
        );

        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (id, entry_id, line_number, account_id, direction, amount, memo) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            entry.getLines(),
            entry.getLines().size(),
            (ps, line) -> {
                ps.setObject(1, line.getId());
                ps.setObject(2, line.getEntryId());
                ps.setInt(3, line.getLineNumber());
                ps.setObject(4, line.getAccountId());
                ps.setString(5, line.getDirection().name());
                ps.setLong(6, line.getAmount());
                ps.setString(7, line.getMemo());
            });
    }

    public Optional<JournalEntry> findById(UUID entryId) {
        List<JournalEntry> entries = jdbcTemplate.query(
            "SELECT * FROM journal_entries WHERE id = ?",
            (rs, rowNum) -> mapEntry(rs, Collections.emptyList()),
            entryId);
        return entries.stream().findFirst()
            .map(entry -> entry.toBuilder().lines(findLines(entry.getId())).build());
    }

    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.queryForList(
            "SELECT id FROM journal_entries WHERE idempotency_key = ?", UUID.class, idempotencyKey
        ).stream().findFirst();
    }

    /**
     * Lists entries matching all non-null filters, ordered by date then entry number.
     */
    public List<JournalEntry> find(LocalDate fromDate, LocalDate toDate,
                                   JournalEntryStatus status, JournalEntryType entryType) {
        StringBuilder sql = new StringBuilder("SELECT * FROM journal_entries WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (fromDate != null) {
            sql.append(" AND entry_date >= ?");
            args.add(fromDate);
        }
        if (toDate != null) {
            sql.append(" AND entry_date <= ?");
            args.add(toDate);
        }
        if (status != null) {
            sql.append(" AND status = ?");
            args.add(status.name());
        }
        if (entryType != null) {
            sql.append(" AND entry_type = ?");
            args.add(entryType.name());
        }
        sql.append(" ORDER BY entry_date, entry_number");

        List<JournalEntry> entries = jdbcTemplate.query(sql.toString(),
            (rs, rowNum) -> mapEntry(rs, Collections.emptyList()), args.toArray());
        if (entries.isEmpty()) {
            return entries;
        }

        Map<UUID, List<JournalLine>> linesByEntry = findLines(entries.stream().map(JournalEntry::getId).toList());
        return entries.stream()
            .map(e -> e.toBuilder().lines(linesByEntry.getOrDefault(e.getId(), List.of())).build())
            .toList();
    }

    /**
     * @return 1 if the entry was DRAFT and is now POSTED, 0 otherwise
     */
    public int markPosted(UUID entryId, String postedBy, Instant postedAt) {
        return jdbcTemplate.update(
            "UPDATE journal_entries SET status = 'POSTED', posted_by = ?, posted_at = ? " +
            "WHERE id = ? AND status = 'DRAFT'",
            postedBy, Timestamp.from(postedAt), entryId);
    }

    /**
     * @return 1 if the entry was POSTED and is now VOIDED, 0 otherwise
     */
    public int markVoided(UUID entryId, String voidedBy, Instant voidedAt, String reason) {
        return jdbcTemplate.update(
            "UPDATE journal_entries SET status = 'VOIDED', voided_by = ?, voided_at = ?, void_reason = ? " +
            "WHERE id = ? AND status = 'POSTED'",
            voidedBy, Timestamp.from(voidedAt), reason, entryId);
    }

    /**
     * Removes a DRAFT entry; lines go with it (ON DELETE CASCADE).
     *
     * @return 1 if a draft was deleted, 0 otherwise
     */
    public int deleteDraft(UUID entryId) {
        return jdbcTemplate.update("DELETE FROM journal_entries WHERE id = ? AND status = 'DRAFT'", entryId);
    }

    public int countByPeriodAndStatus(int fiscalYear, int fiscalMonth, JournalEntryStatus status) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE fiscal_year = ? AND fiscal_month = ? AND status = ?",
            Integer.class,
            fiscalYear, fiscalMonth, status.name());
        return count != null ? count : 0;
    }

    public Optional<PostedLine> findPostedLine(UUID lineId) {
        return jdbcTemplate.query(
            "SELECT l.*, e.entry_number, e.entry_date FROM journal_lines l " +
            "JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.id = ? AND e.status = 'POSTED'",
            POSTED_LINE_MAPPER,
            lineId
        ).stream().findFirst();
    }

    /**
     * Posted lines on an account dated within [fromDate, toDate], in entry order.
     */
    public List<PostedLine> findPostedLines(UUID accountId, LocalDate fromDate, LocalDate toDate) {
        return jdbcTemplate.query(
            "SELECT l.*, e.entry_number, e.entry_date FROM journal_lines l " +
            "JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.account_id = ? AND e.status = 'POSTED' AND e.entry_date BETWEEN ? AND ? " +
            "ORDER BY e.entry_date, e.entry_number, l.line_number",
            POSTED_LINE_MAPPER,
            accountId, fromDate, toDate);
    }

    private List<JournalLine> findLines(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT * FROM journal_lines WHERE entry_id = ? ORDER BY line_number",
            LINE_MAPPER,
            entryId);
    }

    private Map<UUID, List<JournalLine>> findLines(List<UUID> entryIds) {
        String placeholders = entryIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        List<JournalLine> lines = jdbcTemplate.query(
            "SELECT * FROM journal_lines WHERE entry_id IN (" + placeholders + ") ORDER BY entry_id, line_number",
            LINE_MAPPER,
            entryIds.toArray());
        return lines.stream().collect(Collectors.groupingBy(
            JournalLine::getEntryId, LinkedHashMap::new, Collectors.toList()));
    }

    private static JournalEntry mapEntry(ResultSet rs, List<JournalLine> lines) throws SQLException {
        return JournalEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .entryNumber(rs.getString("entry_number"))
            .entryDate(rs.getObject("entry_date", LocalDate.class))
            .description(rs.getString("description"))
            .reference(rs.getString("reference"))
            .entryType(JournalEntryType.valueOf(rs.getString("entry_type")))
            .status(JournalEntryStatus.valueOf(rs.getString("status")))
            .lines(lines)
            .createdBy(rs.getString("created_by"))
            .postedBy(rs.getString("posted_by"))
            .postedAt(toInstant(rs.getTimestamp("posted_at")))
            .voidedBy(rs.getString("voided_by"))
            .voidedAt(toInstant(rs.getTimestamp("voided_at")))
            .voidReason(rs.getString("void_reason"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
