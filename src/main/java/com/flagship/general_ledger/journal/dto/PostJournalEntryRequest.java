package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class PostJournalEntryRequest {

    @NotBlank(message = "Posted by is required")
    @JsonProperty("posted_by")
    String postedBy;
}
