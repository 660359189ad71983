package com.flagship.general_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class AutoMatchResult {

    @JsonProperty("matched_count")
    int matchedCount;

    @JsonProperty("unmatched_count")
    int unmatchedCount;

    @JsonProperty("matches")
    List<TransactionMatch> matches;
}
