package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.reconciliation.BankAccount;
import com.flagship.general_ledger.reconciliation.BankAccountStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BankAccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("linked_account_id")
    UUID linkedAccountId;

    @JsonProperty("bank_name")
    String bankName;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    BankAccountStatus status;

    @JsonProperty("last_reconciled_year")
    Integer lastReconciledYear;

    @JsonProperty("last_reconciled_month")
    Integer lastReconciledMonth;

    @JsonProperty("last_reconciled_balance")
    Long lastReconciledBalance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BankAccountResponse from(BankAccount bankAccount) {
        return BankAccountResponse.builder()
            .id(bankAccount.getId())
            .linkedAccountId(bankAccount.getLinkedAccountId())
            .bankName(bankAccount.getBankName())
            .accountNumber(bankAccount.getAccountNumber())
            .currency(bankAccount.getCurrency())
            .status(bankAccount.getStatus())
            .lastReconciledYear(bankAccount.getLastReconciledYear())
            .lastReconciledMonth(bankAccount.getLastReconciledMonth())
            .lastReconciledBalance(bankAccount.getLastReconciledBalance())
            .createdAt(bankAccount.getCreatedAt())
            .build();
    }
}
