package com.flagship.general_ledger.journal;

/**
 * Whether an entry whose period is CLOSED may still be voided.
 * Configured with {@code ledger.journal.void-in-closed-period}.
 * Entries in LOCKED periods can never be voided.
 */
public enum VoidPolicy {
    ALLOW,
    REJECT
}
