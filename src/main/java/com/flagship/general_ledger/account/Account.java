package com.flagship.general_ledger.account;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A chart-of-accounts entry.
 *
 * Codes are 3 to 10 digits; a child's code usually extends its parent's
 * (1000 Assets, 1100 Cash, 1110 Operating Bank) but that is a naming
 * convention, not a rule. Code, type and normal balance become fixed as
 * soon as a posted journal line references the account.
 */
@Value
@Builder(toBuilder = true)
public class Account {

    private static final Pattern CODE_PATTERN = Pattern.compile("^\\d{3,10}$");
    private static final int MAX_NAME_LENGTH = 200;

    UUID id;
    String code;
    String name;
    String description;
    AccountType accountType;
    NormalBalance normalBalance;
    UUID parentId;
    AccountStatus status;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE account. The normal balance defaults to the type's natural side.
     *
     * @throws ValidationException if code, name or type are invalid
     */
    public static Account create(String code, String name, String description,
                                 AccountType accountType, NormalBalance normalBalance, UUID parentId) {
        validateCode(code);
        validateName(name);
        if (accountType == null) {
            throw new ValidationException("Account type is required");
        }

        Instant now = Instant.now();
        return new Account(
            UUID.randomUUID(),
            code,
            name.trim(),
            description,
            accountType,
            normalBalance != null ? normalBalance : accountType.naturalBalance(),
            parentId,
            AccountStatus.ACTIVE,
            now,
            now
        );
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public boolean isDebitNormal() {
        return normalBalance == NormalBalance.DEBIT;
    }

    /**
     * Returns a copy with the descriptive fields and parent replaced. Null keeps the current value.
     */
    public Account withDetails(String newName, String newDescription, UUID newParentId) {
        if (newName != null) {
            validateName(newName);
        }
        if (newParentId != null && newParentId.equals(id)) {
            throw new ValidationException("Account cannot be its own parent");
        }
        return toBuilder()
            .name(newName != null ? newName.trim() : name)
            .description(newDescription != null ? newDescription : description)
            .parentId(newParentId != null ? newParentId : parentId)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Returns a copy with type and normal balance replaced. Null keeps the current value,
     * except that a new type without an explicit side takes the type's natural side.
     * Callers must check that no posted line references the account first.
     */
    public Account withStructure(AccountType newType, NormalBalance newNormalBalance) {
        AccountType type = newType != null ? newType : accountType;
        NormalBalance side = newNormalBalance != null
            ? newNormalBalance
            : (newType != null ? newType.naturalBalance() : normalBalance);
        return toBuilder()
            .accountType(type)
            .normalBalance(side)
            .updatedAt(Instant.now())
            .build();
    }

    public Account withStatus(AccountStatus newStatus) {
        return toBuilder().status(newStatus).updatedAt(Instant.now()).build();
    }

    public boolean hasStructuralChange(AccountType newType, NormalBalance newNormalBalance) {
        return (newType != null && newType != accountType)
            || (newNormalBalance != null && newNormalBalance != normalBalance);
    }

    static void validateCode(String code) {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            throw new ValidationException("Account code must be 3 to 10 digits: " + code);
        }
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Account name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }
}
