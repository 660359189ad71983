package com.flagship.general_ledger.reconciliation;

/**
 * Kinds of difference between the bank statement and the books.
 *
 * Bank-side items (outstanding checks, deposits in transit) are timing
 * differences the bank has not seen yet. Book-side items are things the bank
 * recorded that the books have not, and usually need an adjusting entry.
 */
public enum ReconcilingItemType {
    OUTSTANDING_CHECK(false),
    DEPOSIT_IN_TRANSIT(false),
    BANK_FEE(true),
    BANK_INTEREST(true),
    NSF_CHECK(true),
    ADJUSTMENT(false);

    private final boolean requiresJournalEntryByDefault;

    ReconcilingItemType(boolean requiresJournalEntryByDefault) {
        this.requiresJournalEntryByDefault = requiresJournalEntryByDefault;
    }

    public boolean requiresJournalEntryByDefault() {
        return requiresJournalEntryByDefault;
    }

    /** ADJUSTMENT carries its own sign; every other type is a positive amount. */
    public boolean isSigned() {
        return this == ADJUSTMENT;
    }
}
