package com.flagship.general_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.AccountStatus;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.NormalBalance;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Partial update; absent fields are left unchanged.
 */
@Value
public class UpdateAccountRequest {

    @Size(min = 1, max = 200, message = "Name must be 1 to 200 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("normal_balance")
    NormalBalance normalBalance;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("status")
    AccountStatus status;
}
