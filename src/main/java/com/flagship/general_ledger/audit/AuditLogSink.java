package com.flagship.general_ledger.audit;

/**
 * Destination for audit records of ledger mutations.
 *
 * Implementations are called inside the mutating transaction; a record
 * must only become visible if that transaction commits.
 */
public interface AuditLogSink {

    void record(AuditRecord record);
}
