package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class MatchTransactionRequest {

    @NotNull(message = "Bank transaction ID is required")
    @JsonProperty("bank_transaction_id")
    UUID bankTransactionId;

    @NotNull(message = "Journal line ID is required")
    @JsonProperty("journal_line_id")
    UUID journalLineId;

    @NotBlank(message = "Matched by is required")
    @JsonProperty("matched_by")
    String matchedBy;
}
