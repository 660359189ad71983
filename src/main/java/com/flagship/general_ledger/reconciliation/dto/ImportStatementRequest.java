package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.reconciliation.StatementLine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class ImportStatementRequest {

    @NotBlank(message = "Imported by is required")
    @JsonProperty("imported_by")
    String importedBy;

    @NotEmpty(message = "Transactions are required")
    @Valid
    @JsonProperty("transactions")
    List<TransactionRequest> transactions;

    public List<StatementLine> toStatementLines() {
        return transactions.stream()
            .map(t -> new StatementLine(t.getTransactionDate(), t.getDescription(), t.getAmount(), t.getReference()))
            .toList();
    }

    @Value
    public static class TransactionRequest {

        @NotNull(message = "Transaction date is required")
        @JsonProperty("transaction_date")
        LocalDate transactionDate;

        @JsonProperty("description")
        String description;

        /** Signed; positive is money into the account. */
        @NotNull(message = "Amount is required")
        @JsonProperty("amount")
        Long amount;

        @Size(max = 100, message = "Reference must be at most 100 characters")
        @JsonProperty("reference")
        String reference;
    }
}
