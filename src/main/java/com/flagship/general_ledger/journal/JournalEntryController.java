package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.journal.dto.CreateJournalEntryRequest;
import com.flagship.general_ledger.journal.dto.JournalEntryResponse;
import com.flagship.general_ledger.journal.dto.PostJournalEntryRequest;
import com.flagship.general_ledger.journal.dto.VoidJournalEntryRequest;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints for journal entries.
 *
 * Creation is idempotent when the caller sends an Idempotency-Key header:
 * a repeated key returns the entry created the first time (200) instead of a
 * new one (201).
 */
@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final JournalEntryService journalEntryService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> createEntry(
            @Valid @RequestBody CreateJournalEntryRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        String entryType = request.getEntryType().name();

        log.info("Received journal entry creation request: idempotencyKey={}, type={}, lines={}",
            idempotencyKey, entryType, request.getLines().size());

        try {
            if (idempotencyKey != null) {
                Optional<UUID> existingId = idempotencyService.findEntryForKey(idempotencyKey);
                if (existingId.isPresent()) {
                    metrics.recordIdempotencyHit();
                    MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, existingId.get().toString());
                    log.info("Idempotency key already used, returning existing journal entry");
                    return ResponseEntity.ok(JournalEntryResponse.from(journalEntryService.getEntry(existingId.get())));
                }
                metrics.recordIdempotencyMiss();
            }

            JournalEntry entry = journalEntryService.createEntry(request.toDomain(), idempotencyKey);
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());

            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, entry.getId());
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryCreated(entryType, "success");
            metrics.recordLatency("entry_create", duration);

            return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryCreated(entryType, "error");
            metrics.recordLatency("entry_create", duration);
            log.warn("Journal entry creation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @GetMapping
    public List<JournalEntryResponse> listEntries(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "status", required = false) JournalEntryStatus status,
            @RequestParam(value = "entry_type", required = false) JournalEntryType entryType) {
        return journalEntryService.listEntries(from, to, status, entryType).stream()
            .map(JournalEntryResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public JournalEntryResponse getEntry(@PathVariable("id") UUID id) {
        return JournalEntryResponse.from(journalEntryService.getEntry(id));
    }

    @PostMapping("/{id}/post")
    public JournalEntryResponse postEntry(@PathVariable("id") UUID id,
                                          @Valid @RequestBody PostJournalEntryRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, id.toString());
        try {
            JournalEntry posted = journalEntryService.postEntry(id, request.getPostedBy());
            metrics.recordEntryPosted("success");
            metrics.recordLatency("entry_post", System.currentTimeMillis() - startTime);
            return JournalEntryResponse.from(posted);
        } catch (RuntimeException e) {
            metrics.recordEntryPosted("rejected");
            log.warn("Journal entry post rejected: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/void")
    public JournalEntryResponse voidEntry(@PathVariable("id") UUID id,
                                          @Valid @RequestBody VoidJournalEntryRequest request) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, id.toString());
        try {
            JournalEntry voided = journalEntryService.voidEntry(id, request.getReason(), request.getVoidedBy());
            metrics.recordEntryVoided("success");
            return JournalEntryResponse.from(voided);
        } catch (RuntimeException e) {
            metrics.recordEntryVoided("rejected");
            log.warn("Journal entry void rejected: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDraft(@PathVariable("id") UUID id) {
        journalEntryService.deleteDraft(id);
        return ResponseEntity.noContent().build();
    }
}
