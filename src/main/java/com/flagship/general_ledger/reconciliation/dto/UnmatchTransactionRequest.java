package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class UnmatchTransactionRequest {

    @NotNull(message = "Bank transaction ID is required")
    @JsonProperty("bank_transaction_id")
    UUID bankTransactionId;

    @NotBlank(message = "Unmatched by is required")
    @JsonProperty("unmatched_by")
    String unmatchedBy;
}
