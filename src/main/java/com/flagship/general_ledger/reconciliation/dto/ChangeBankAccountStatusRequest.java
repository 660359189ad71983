package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.reconciliation.BankAccountStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ChangeBankAccountStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    BankAccountStatus status;
}
