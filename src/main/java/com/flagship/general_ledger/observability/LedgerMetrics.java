package com.flagship.general_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * <ul>
 *   <li>ledger.entries.created / posted / voided, tagged by entry type and outcome</li>
 *   <li>ledger.periods.transitions, tagged by transition and outcome</li>
 *   <li>ledger.balances.recalculated, tagged by whether the period balanced</li>
 *   <li>ledger.reconciliation.auto_match, matched and unmatched counts</li>
 *   <li>ledger.operation.latency, timer per operation</li>
 *   <li>idempotency.cache, hit or miss</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEntryCreated(String entryType, String outcome) {
        registry.counter("ledger.entries.created",
                "entry_type", sanitizeTag(entryType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordEntryPosted(String outcome) {
        registry.counter("ledger.entries.posted", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordEntryVoided(String outcome) {
        registry.counter("ledger.entries.voided", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordPeriodTransition(String transition, String outcome) {
        registry.counter("ledger.periods.transitions",
                "transition", sanitizeTag(transition),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordRecalculation(boolean balanced, int accountsProcessed) {
        registry.counter("ledger.balances.recalculated", "balanced", String.valueOf(balanced)).increment();
        registry.counter("ledger.balances.accounts_processed").increment(accountsProcessed);
    }

    public void recordAutoMatch(int matched, int unmatched) {
        registry.counter("ledger.reconciliation.auto_match", "result", "matched").increment(matched);
        registry.counter("ledger.reconciliation.auto_match", "result", "unmatched").increment(unmatched);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
