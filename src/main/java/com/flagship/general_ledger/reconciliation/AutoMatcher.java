package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.journal.PostedLine;

import java.util.List;

/**
 * Pairs unmatched bank transactions with unmatched posted journal lines.
 * Each transaction and each line appears in at most one returned match.
 */
public interface AutoMatcher {

    List<TransactionMatch> match(List<BankTransaction> transactions, List<PostedLine> candidates,
                                 int dateToleranceDays);
}
