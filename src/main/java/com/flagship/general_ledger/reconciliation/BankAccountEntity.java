package com.flagship.general_ledger.reconciliation;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bank_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BankAccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "linked_account_id", nullable = false, updatable = false)
    private UUID linkedAccountId;

    @Column(name = "bank_name", nullable = false, updatable = false, length = 200)
    private String bankName;

    @Column(name = "account_number", nullable = false, updatable = false, length = 50)
    private String accountNumber;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private BankAccountStatus status;

    @Column(name = "last_reconciled_year")
    private Integer lastReconciledYear;

    @Column(name = "last_reconciled_month")
    private Integer lastReconciledMonth;

    @Column(name = "last_reconciled_balance")
    private Long lastReconciledBalance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static BankAccountEntity fromDomain(BankAccount bankAccount) {
        return new BankAccountEntity(
            bankAccount.getId(),
            bankAccount.getLinkedAccountId(),
            bankAccount.getBankName(),
            bankAccount.getAccountNumber(),
            bankAccount.getCurrency(),
            bankAccount.getStatus(),
            bankAccount.getLastReconciledYear(),
            bankAccount.getLastReconciledMonth(),
            bankAccount.getLastReconciledBalance(),
            null,
            null
        );
    }

    public BankAccount toDomain() {
        return new BankAccount(
            id,
            linkedAccountId,
            bankName,
            accountNumber,
            currency,
            status,
            lastReconciledYear,
            lastReconciledMonth,
            lastReconciledBalance,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(BankAccount bankAccount) {
        this.status = bankAccount.getStatus();
        this.lastReconciledYear = bankAccount.getLastReconciledYear();
        this.lastReconciledMonth = bankAccount.getLastReconciledMonth();
        this.lastReconciledBalance = bankAccount.getLastReconciledBalance();
    }
}
