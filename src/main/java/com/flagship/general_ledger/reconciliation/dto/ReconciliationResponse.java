package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.reconciliation.BankTransaction;
import com.flagship.general_ledger.reconciliation.MatchStatus;
import com.flagship.general_ledger.reconciliation.Reconciliation;
import com.flagship.general_ledger.reconciliation.ReconciliationStatus;
import com.flagship.general_ledger.reconciliation.ReconcilingItem;
import com.flagship.general_ledger.reconciliation.ReconcilingItemType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("bank_account_id")
    UUID bankAccountId;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("statement_ending_balance")
    long statementEndingBalance;

    @JsonProperty("book_ending_balance")
    long bookEndingBalance;

    @JsonProperty("adjusted_bank_balance")
    Long adjustedBankBalance;

    @JsonProperty("adjusted_book_balance")
    Long adjustedBookBalance;

    @JsonProperty("status")
    ReconciliationStatus status;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("completed_by")
    String completedBy;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("approved_by")
    String approvedBy;

    @JsonProperty("approved_at")
    Instant approvedAt;

    @JsonProperty("transactions")
    List<Transaction> transactions;

    @JsonProperty("items")
    List<Item> items;

    public static ReconciliationResponse from(Reconciliation reconciliation,
                                              List<BankTransaction> transactions,
                                              List<ReconcilingItem> items) {
        return ReconciliationResponse.builder()
            .id(reconciliation.getId())
            .bankAccountId(reconciliation.getBankAccountId())
            .fiscalYear(reconciliation.getFiscalYear())
            .fiscalMonth(reconciliation.getFiscalMonth())
            .statementEndingBalance(reconciliation.getStatementEndingBalance())
            .bookEndingBalance(reconciliation.getBookEndingBalance())
            .adjustedBankBalance(reconciliation.getAdjustedBankBalance())
            .adjustedBookBalance(reconciliation.getAdjustedBookBalance())
            .status(reconciliation.getStatus())
            .createdBy(reconciliation.getCreatedBy())
            .completedBy(reconciliation.getCompletedBy())
            .completedAt(reconciliation.getCompletedAt())
            .approvedBy(reconciliation.getApprovedBy())
            .approvedAt(reconciliation.getApprovedAt())
            .transactions(transactions.stream().map(Transaction::from).toList())
            .items(items.stream().map(Item::from).toList())
            .build();
    }

    @Value
    public static class Transaction {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("transaction_date")
        LocalDate transactionDate;

        @JsonProperty("description")
        String description;

        @JsonProperty("amount")
        long amount;

        @JsonProperty("reference")
        String reference;

        @JsonProperty("match_status")
        MatchStatus matchStatus;

        @JsonProperty("matched_journal_line_id")
        UUID matchedJournalLineId;

        @JsonProperty("matched_by")
        String matchedBy;

        public static Transaction from(BankTransaction transaction) {
            return new Transaction(transaction.getId(), transaction.getTransactionDate(),
                transaction.getDescription(), transaction.getAmount(), transaction.getReference(),
                transaction.getMatchStatus(), transaction.getMatchedJournalLineId(), transaction.getMatchedBy());
        }
    }

    @Value
    public static class Item {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("item_type")
        ReconcilingItemType itemType;

        @JsonProperty("description")
        String description;

        @JsonProperty("amount")
        long amount;

        @JsonProperty("item_date")
        LocalDate itemDate;

        @JsonProperty("reference")
        String reference;

        @JsonProperty("requires_journal_entry")
        boolean requiresJournalEntry;

        @JsonProperty("journal_entry_id")
        UUID journalEntryId;

        @JsonProperty("bank_transaction_id")
        UUID bankTransactionId;

        public static Item from(ReconcilingItem item) {
            return new Item(item.getId(), item.getItemType(), item.getDescription(), item.getAmount(),
                item.getItemDate(), item.getReference(), item.isRequiresJournalEntry(),
                item.getJournalEntryId(), item.getBankTransactionId());
        }
    }
}
