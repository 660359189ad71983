package com.flagship.general_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class TransactionMatch {

    @JsonProperty("bank_transaction_id")
    UUID bankTransactionId;

    @JsonProperty("journal_line_id")
    UUID journalLineId;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("day_difference")
    long dayDifference;
}
