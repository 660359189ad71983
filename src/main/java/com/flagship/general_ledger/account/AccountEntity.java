package com.flagship.general_ledger.account;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the accounts table.
 *
 * No setters: state changes go through the {@link Account} domain object and
 * are copied back with {@link #updateFromDomain(Account)}. The code column is
 * never updated.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 10)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 20)
    private AccountType accountType;

    @Enumerated(EnumType.STRING)
    @Column(name = "normal_balance", nullable = false, length = 10)
    private NormalBalance normalBalance;

    @Column(name = "parent_id")
    private UUID parentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountStatus status;

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

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getCode(),
            account.getName(),
            account.getDescription(),
            account.getAccountType(),
            account.getNormalBalance(),
            account.getParentId(),
            account.getStatus(),
            null, // set by @PrePersist
            null
        );
    }

    public Account toDomain() {
        return new Account(
            id,
            code,
            name,
            description,
            accountType,
            normalBalance,
            parentId,
            status,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Account account) {
        this.name = account.getName();
        this.description = account.getDescription();
        this.accountType = account.getAccountType();
        this.normalBalance = account.getNormalBalance();
        this.parentId = account.getParentId();
        this.status = account.getStatus();
    }
}
