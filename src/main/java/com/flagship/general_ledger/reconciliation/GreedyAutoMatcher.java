package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.journal.Direction;
import com.flagship.general_ledger.journal.PostedLine;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * First-come matcher. Transactions are taken in (date, import order); each
 * takes the best unused line with the same signed amount within the date
 * tolerance. Best means smallest date difference, then earliest line date,
 * then entry number and line number.
 *
 * A debit on the bank's GL account is money in, so a DEBIT line pairs with a
 * positive bank amount and a CREDIT line with a negative one.
 */
@Component
public class GreedyAutoMatcher implements AutoMatcher {

    private static final Comparator<BankTransaction> TRANSACTION_ORDER = Comparator
        .comparing(BankTransaction::getTransactionDate)
        .thenComparingLong(BankTransaction::getSequenceNumber);

    private static final Comparator<PostedLine> CANDIDATE_ORDER = Comparator
        .comparing(PostedLine::getEntryDate)
        .thenComparing(PostedLine::getEntryNumber)
        .thenComparingInt(PostedLine::getLineNumber);

    @Override
    public List<TransactionMatch> match(List<BankTransaction> transactions, List<PostedLine> candidates,
                                        int dateToleranceDays) {
        List<BankTransaction> pending = transactions.stream()
            .filter(t -> !t.isMatched())
            .sorted(TRANSACTION_ORDER)
            .toList();
        List<PostedLine> available = new ArrayList<>(candidates.stream().sorted(CANDIDATE_ORDER).toList());

        List<TransactionMatch> matches = new ArrayList<>();
        for (BankTransaction transaction : pending) {
            int bestIndex = -1;
            long bestDiff = Long.MAX_VALUE;

            for (int i = 0; i < available.size(); i++) {
                PostedLine line = available.get(i);
                if (signedAmount(line) != transaction.getAmount()) {
                    continue;
                }
                long diff = Math.abs(ChronoUnit.DAYS.between(line.getEntryDate(), transaction.getTransactionDate()));
                // strict: among equal differences the earlier candidate in order wins
                if (diff <= dateToleranceDays && diff < bestDiff) {
                    bestIndex = i;
                    bestDiff = diff;
                }
            }

            if (bestIndex >= 0) {
                PostedLine line = available.remove(bestIndex);
                matches.add(new TransactionMatch(transaction.getId(), line.getLineId(), line.getEntryNumber(),
                    transaction.getAmount(), bestDiff));
            }
        }
        return matches;
    }

    static long signedAmount(PostedLine line) {
        return line.getDirection() == Direction.DEBIT ? line.getAmount() : -line.getAmount();
    }
}
