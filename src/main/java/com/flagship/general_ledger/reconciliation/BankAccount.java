package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A bank account and the ASSET GL account that mirrors it in the books.
 * CLOSED is terminal.
 */
@Value
@Builder(toBuilder = true)
public class BankAccount {

    public static final String DEFAULT_CURRENCY = "USD";

    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{3}$");

    UUID id;
    UUID linkedAccountId;
    String bankName;
    String accountNumber;
    String currency;
    BankAccountStatus status;
    Integer lastReconciledYear;
    Integer lastReconciledMonth;
    Long lastReconciledBalance;
    Instant createdAt;
    Instant updatedAt;

    public static BankAccount create(UUID linkedAccountId, String bankName, String accountNumber, String currency) {
        if (linkedAccountId == null) {
            throw new ValidationException("Linked account is required");
        }
        if (bankName == null || bankName.isBlank()) {
            throw new ValidationException("Bank name is required");
        }
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new ValidationException("Account number is required");
        }
        String resolvedCurrency = currency == null ? DEFAULT_CURRENCY : currency.trim().toUpperCase();
        if (!CURRENCY_PATTERN.matcher(resolvedCurrency).matches()) {
            throw new ValidationException("Currency must be a 3-letter ISO code: " + currency);
        }
        return BankAccount.builder()
            .id(UUID.randomUUID())
            .linkedAccountId(linkedAccountId)
            .bankName(bankName.trim())
            .accountNumber(accountNumber.trim())
            .currency(resolvedCurrency)
            .status(BankAccountStatus.ACTIVE)
            .build();
    }

    /**
     * @throws InvalidStateException if the account is CLOSED
     */
    public BankAccount withStatus(BankAccountStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("Status is required");
        }
        if (status == BankAccountStatus.CLOSED && newStatus != BankAccountStatus.CLOSED) {
            throw new InvalidStateException("Bank account " + accountNumber + " is CLOSED");
        }
        return toBuilder().status(newStatus).build();
    }

    public BankAccount recordReconciled(int fiscalYear, int fiscalMonth, long balance) {
        return toBuilder()
            .lastReconciledYear(fiscalYear)
            .lastReconciledMonth(fiscalMonth)
            .lastReconciledBalance(balance)
            .build();
    }

    public boolean isActive() {
        return status == BankAccountStatus.ACTIVE;
    }
}
