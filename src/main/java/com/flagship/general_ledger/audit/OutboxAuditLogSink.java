package com.flagship.general_ledger.audit;

import com.flagship.general_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes audit records to the transactional outbox, from where the
 * publisher forwards them to the audit topic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxAuditLogSink implements AuditLogSink {

    public static final String AGGREGATE_TYPE = "AuditLog";
    public static final String EVENT_TYPE = "AuditRecorded";

    private final OutboxService outboxService;

    @Override
    public void record(AuditRecord record) {
        outboxService.saveEvent(AGGREGATE_TYPE, record.getEntityId(), EVENT_TYPE, record);
        log.debug("Audit recorded: action={}, entityType={}, entityId={}",
                record.getAction(), record.getEntityType(), record.getEntityId());
    }
}
