package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.journal.dto.JournalEntryResponse;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.reconciliation.dto.AddReconcilingItemRequest;
import com.flagship.general_ledger.reconciliation.dto.AutoMatchRequest;
import com.flagship.general_ledger.reconciliation.dto.CreateAdjustingEntriesRequest;
import com.flagship.general_ledger.reconciliation.dto.CreateReconciliationRequest;
import com.flagship.general_ledger.reconciliation.dto.ImportStatementRequest;
import com.flagship.general_ledger.reconciliation.dto.MatchTransactionRequest;
import com.flagship.general_ledger.reconciliation.dto.ReconciliationActionRequest;
import com.flagship.general_ledger.reconciliation.dto.ReconciliationResponse;
import com.flagship.general_ledger.reconciliation.dto.UnmatchTransactionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/reconciliations")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @PostMapping
    public ResponseEntity<ReconciliationResponse> createReconciliation(
            @Valid @RequestBody CreateReconciliationRequest request) {
        Reconciliation reconciliation = reconciliationService.createReconciliation(
            request.getBankAccountId(),
            request.getFiscalYear(),
            request.getFiscalMonth(),
            request.getStatementEndingBalance(),
            request.getBookEndingBalance(),
            request.getCreatedBy());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ReconciliationResponse.from(reconciliation, List.of(), List.of()));
    }

    @GetMapping("/{id}")
    public ReconciliationResponse getReconciliation(@PathVariable("id") UUID id) {
        return view(id);
    }

    @PostMapping("/{id}/import-statement")
    public ImportResult importStatement(@PathVariable("id") UUID id,
                                        @Valid @RequestBody ImportStatementRequest request) {
        return withReconciliationId(id, () ->
            reconciliationService.importStatement(id, request.toStatementLines(), request.getImportedBy()));
    }

    @PostMapping("/{id}/match")
    public ReconciliationResponse.Transaction matchTransaction(@PathVariable("id") UUID id,
                                                               @Valid @RequestBody MatchTransactionRequest request) {
        return withReconciliationId(id, () -> ReconciliationResponse.Transaction.from(
            reconciliationService.matchTransaction(id, request.getBankTransactionId(),
                request.getJournalLineId(), request.getMatchedBy())));
    }

    @PostMapping("/{id}/unmatch")
    public ReconciliationResponse.Transaction unmatchTransaction(@PathVariable("id") UUID id,
                                                                 @Valid @RequestBody UnmatchTransactionRequest request) {
        return withReconciliationId(id, () -> ReconciliationResponse.Transaction.from(
            reconciliationService.unmatchTransaction(id, request.getBankTransactionId(), request.getUnmatchedBy())));
    }

    @PostMapping("/{id}/auto-match")
    public AutoMatchResult autoMatch(@PathVariable("id") UUID id, @Valid @RequestBody AutoMatchRequest request) {
        return withReconciliationId(id, () ->
            reconciliationService.autoMatch(id, request.getDateToleranceDays(), request.getMatchedBy()));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<ReconciliationResponse.Item> addItem(@PathVariable("id") UUID id,
                                                               @Valid @RequestBody AddReconcilingItemRequest request) {
        ReconcilingItem item = withReconciliationId(id, () -> reconciliationService.addReconcilingItem(
            id,
            request.getItemType(),
            request.getDescription(),
            request.getAmount(),
            request.getItemDate(),
            request.getReference(),
            request.getRequiresJournalEntry(),
            request.getBankTransactionId(),
            request.getCreatedBy()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ReconciliationResponse.Item.from(item));
    }

    @PostMapping("/{id}/calculate")
    public AdjustedBalances calculate(@PathVariable("id") UUID id) {
        return withReconciliationId(id, () -> reconciliationService.calculate(id));
    }

    @PostMapping("/{id}/adjusting-entries")
    public List<JournalEntryResponse> createAdjustingEntries(@PathVariable("id") UUID id,
                                                             @Valid @RequestBody CreateAdjustingEntriesRequest request) {
        return withReconciliationId(id, () ->
            reconciliationService.createAdjustingEntries(id, request.toAccounts(), request.getCreatedBy()).stream()
                .map(JournalEntryResponse::from)
                .toList());
    }

    @PostMapping("/{id}/complete")
    public ReconciliationResponse complete(@PathVariable("id") UUID id,
                                           @Valid @RequestBody ReconciliationActionRequest request) {
        withReconciliationId(id, () -> reconciliationService.complete(id, request.getPerformedBy()));
        return view(id);
    }

    @PostMapping("/{id}/approve")
    public ReconciliationResponse approve(@PathVariable("id") UUID id,
                                          @Valid @RequestBody ReconciliationActionRequest request) {
        withReconciliationId(id, () -> reconciliationService.approve(id, request.getPerformedBy()));
        return view(id);
    }

    private ReconciliationResponse view(UUID id) {
        return ReconciliationResponse.from(
            reconciliationService.getReconciliation(id),
            reconciliationService.getTransactions(id),
            reconciliationService.getItems(id));
    }

    private static <T> T withReconciliationId(UUID id, Supplier<T> action) {
        MDC.put(CorrelationContext.RECONCILIATION_ID_MDC_KEY, id.toString());
        try {
            return action.get();
        } finally {
            MDC.remove(CorrelationContext.RECONCILIATION_ID_MDC_KEY);
        }
    }
}
