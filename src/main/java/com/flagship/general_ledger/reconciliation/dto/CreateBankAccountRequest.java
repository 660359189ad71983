package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateBankAccountRequest {

    @NotNull(message = "Linked account ID is required")
    @JsonProperty("linked_account_id")
    UUID linkedAccountId;

    @NotBlank(message = "Bank name is required")
    @Size(max = 200, message = "Bank name must be at most 200 characters")
    @JsonProperty("bank_name")
    String bankName;

    @NotBlank(message = "Account number is required")
    @Size(max = 50, message = "Account number must be at most 50 characters")
    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("currency")
    String currency;
}
