package com.flagship.general_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ImportResult {

    @JsonProperty("imported")
    int imported;

    @JsonProperty("duplicates_skipped")
    int duplicatesSkipped;
}
