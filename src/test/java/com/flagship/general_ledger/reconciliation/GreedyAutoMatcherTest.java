package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.journal.Direction;
import com.flagship.general_ledger.journal.PostedLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GreedyAutoMatcherTest {

    private final GreedyAutoMatcher matcher = new GreedyAutoMatcher();
    private final UUID reconciliationId = UUID.randomUUID();
    private final UUID bankGl = UUID.randomUUID();
    private long sequence = 1;

    private BankTransaction transaction(String date, long amount) {
        return new BankTransaction(UUID.randomUUID(), reconciliationId, sequence++, LocalDate.parse(date),
            "stmt", amount, "", MatchStatus.UNMATCHED, null, null, null);
    }

    private PostedLine line(String date, String entryNumber, Direction direction, long amount) {
        return new PostedLine(UUID.randomUUID(), UUID.randomUUID(), entryNumber, LocalDate.parse(date), 1,
            bankGl, direction, amount, null);
    }

    @Test
    @DisplayName("Deposit of 25,000,000 pairs with a same-day debit line")
    void testMatch_SameDayDeposit() {
        BankTransaction deposit = transaction("2026-01-05", 25_000_000);
        PostedLine debit = line("2026-01-05", "JE-2026-000001", Direction.DEBIT, 25_000_000);

        List<TransactionMatch> matches = matcher.match(List.of(deposit), List.of(debit), 3);

        assertEquals(1, matches.size());
        assertEquals(deposit.getId(), matches.get(0).getBankTransactionId());
        assertEquals(debit.getLineId(), matches.get(0).getJournalLineId());
        assertEquals(0, matches.get(0).getDayDifference());
    }

    @Test
    @DisplayName("Withdrawals pair with credit lines, never with debit lines")
    void testMatch_SignNormalization() {
        BankTransaction withdrawal = transaction("2026-01-10", -4_000);
        PostedLine debit = line("2026-01-10", "JE-2026-000001", Direction.DEBIT, 4_000);
        PostedLine credit = line("2026-01-11", "JE-2026-000002", Direction.CREDIT, 4_000);

        List<TransactionMatch> matches = matcher.match(List.of(withdrawal), List.of(debit, credit), 3);

        assertEquals(1, matches.size());
        assertEquals(credit.getLineId(), matches.get(0).getJournalLineId());
    }

    @Test
    @DisplayName("Lines outside the date tolerance are not matched")
    void testMatch_OutsideTolerance() {
        BankTransaction deposit = transaction("2026-01-10", 900);
        PostedLine late = line("2026-01-14", "JE-2026-000001", Direction.DEBIT, 900);

        assertTrue(matcher.match(List.of(deposit), List.of(late), 3).isEmpty());
        assertEquals(1, matcher.match(List.of(deposit), List.of(late), 4).size());
    }

    @Test
    @DisplayName("Closest date wins, then the earlier date, then entry order")
    void testMatch_TieBreaks() {
        BankTransaction deposit = transaction("2026-01-10", 500);
        PostedLine twoDaysAfter = line("2026-01-12", "JE-2026-000001", Direction.DEBIT, 500);
        PostedLine oneDayAfter = line("2026-01-11", "JE-2026-000002", Direction.DEBIT, 500);
        PostedLine oneDayBefore = line("2026-01-09", "JE-2026-000009", Direction.DEBIT, 500);

        List<TransactionMatch> matches = matcher.match(List.of(deposit),
            List.of(twoDaysAfter, oneDayAfter, oneDayBefore), 3);

        assertEquals(oneDayBefore.getLineId(), matches.get(0).getJournalLineId());

        PostedLine sameDayA = line("2026-01-10", "JE-2026-000005", Direction.DEBIT, 500);
        PostedLine sameDayB = line("2026-01-10", "JE-2026-000004", Direction.DEBIT, 500);
        matches = matcher.match(List.of(deposit), List.of(sameDayA, sameDayB), 3);

        assertEquals(sameDayB.getLineId(), matches.get(0).getJournalLineId());
    }

    @Test
    @DisplayName("No transaction or line is used twice, and counts add up")
    void testMatch_NoDoubleMatching() {
        List<BankTransaction> transactions = List.of(
            transaction("2026-01-05", 1_000),
            transaction("2026-01-05", 1_000),
            transaction("2026-01-06", 1_000),
            transaction("2026-01-07", -250));
        List<PostedLine> lines = List.of(
            line("2026-01-05", "JE-2026-000001", Direction.DEBIT, 1_000),
            line("2026-01-06", "JE-2026-000002", Direction.DEBIT, 1_000));

        List<TransactionMatch> matches = matcher.match(transactions, lines, 3);

        Set<UUID> usedTransactions = new HashSet<>();
        Set<UUID> usedLines = new HashSet<>();
        matches.forEach(m -> {
            assertTrue(usedTransactions.add(m.getBankTransactionId()));
            assertTrue(usedLines.add(m.getJournalLineId()));
        });
        assertEquals(2, matches.size());

        // the two earliest transactions, in import order, get the lines
        assertEquals(transactions.get(0).getId(), matches.get(0).getBankTransactionId());
        assertEquals(transactions.get(1).getId(), matches.get(1).getBankTransactionId());
    }

    @Test
    @DisplayName("Already matched transactions are skipped")
    void testMatch_SkipsMatched() {
        BankTransaction matched = new BankTransaction(UUID.randomUUID(), reconciliationId, 1,
            LocalDate.parse("2026-01-05"), "stmt", 700, "", MatchStatus.MATCHED, UUID.randomUUID(), "tester", null);
        PostedLine debit = line("2026-01-05", "JE-2026-000001", Direction.DEBIT, 700);

        assertTrue(matcher.match(List.of(matched), List.of(debit), 3).isEmpty());
    }
}
