package com.flagship.general_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountStatus;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.NormalBalance;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

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

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .description(account.getDescription())
            .accountType(account.getAccountType())
            .normalBalance(account.getNormalBalance())
            .parentId(account.getParentId())
            .status(account.getStatus())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
