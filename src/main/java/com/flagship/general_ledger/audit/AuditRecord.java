package com.flagship.general_ledger.audit;

import com.flagship.general_ledger.observability.CorrelationContext;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One audited mutation: what changed, on which entity, from which values to which.
 */
@Value
public class AuditRecord {
    String action;
    String entityType;
    UUID entityId;
    Map<String, Object> oldValues;
    Map<String, Object> newValues;
    String correlationId;
    Instant occurredAt;

    public static AuditRecord of(String action, String entityType, UUID entityId,
                                 Map<String, Object> oldValues, Map<String, Object> newValues) {
        return new AuditRecord(action, entityType, entityId,
                oldValues != null ? oldValues : Collections.emptyMap(),
                newValues != null ? newValues : Collections.emptyMap(),
                CorrelationContext.getCorrelationId(),
                Instant.now());
    }

    /**
     * Builds an ordered value map from alternating keys and values. Null values are kept.
     */
    public static Map<String, Object> values(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating keys and values");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            values.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return values;
    }
}
