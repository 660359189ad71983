package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class VoidJournalEntryRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @NotBlank(message = "Voided by is required")
    @JsonProperty("voided_by")
    String voidedBy;
}
