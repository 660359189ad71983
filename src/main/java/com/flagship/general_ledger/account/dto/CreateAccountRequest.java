package com.flagship.general_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.NormalBalance;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Code is required")
    @Pattern(regexp = "^\\d{3,10}$", message = "Code must be 3 to 10 digits")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    /** Optional; defaults to the account type's natural side. */
    @JsonProperty("normal_balance")
    NormalBalance normalBalance;

    @JsonProperty("parent_id")
    UUID parentId;
}
