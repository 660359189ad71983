package com.flagship.general_ledger.account;

import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccountTest {

    @Test
    @DisplayName("Normal balance defaults to the account type's natural side")
    void testCreate_DefaultsNormalBalance() {
        assertEquals(NormalBalance.DEBIT, Account.create("1100", "Cash", null, AccountType.ASSET, null, null).getNormalBalance());
        assertEquals(NormalBalance.DEBIT, Account.create("5000", "COGS", null, AccountType.COGS, null, null).getNormalBalance());
        assertEquals(NormalBalance.CREDIT, Account.create("2000", "AP", null, AccountType.LIABILITY, null, null).getNormalBalance());
        assertEquals(NormalBalance.CREDIT, Account.create("4000", "Sales", null, AccountType.REVENUE, null, null).getNormalBalance());
    }

    @Test
    @DisplayName("Contra account can override its natural side")
    void testCreate_ExplicitNormalBalance() {
        Account accumulatedDepreciation = Account.create("1590", "Accumulated Depreciation", null,
            AccountType.ASSET, NormalBalance.CREDIT, null);

        assertEquals(NormalBalance.CREDIT, accumulatedDepreciation.getNormalBalance());
        assertFalse(accumulatedDepreciation.isDebitNormal());
        assertTrue(accumulatedDepreciation.isActive());
    }

    @Test
    @DisplayName("Codes must be 3 to 10 digits")
    void testCreate_InvalidCode() {
        assertThrows(ValidationException.class, () -> Account.create("12", "Cash", null, AccountType.ASSET, null, null));
        assertThrows(ValidationException.class, () -> Account.create("11A0", "Cash", null, AccountType.ASSET, null, null));
        assertThrows(ValidationException.class, () -> Account.create("12345678901", "Cash", null, AccountType.ASSET, null, null));
        assertThrows(ValidationException.class, () -> Account.create(null, "Cash", null, AccountType.ASSET, null, null));
    }

    @Test
    @DisplayName("Name and type are required")
    void testCreate_MissingFields() {
        assertThrows(ValidationException.class, () -> Account.create("1100", " ", null, AccountType.ASSET, null, null));
        assertThrows(ValidationException.class, () -> Account.create("1100", "Cash", null, null, null, null));
    }

    @Test
    @DisplayName("Changing the type without a side moves to the new type's natural side")
    void testWithStructure() {
        Account account = Account.create("1100", "Cash", null, AccountType.ASSET, null, null);

        assertTrue(account.hasStructuralChange(AccountType.EXPENSE, null));
        assertFalse(account.hasStructuralChange(AccountType.ASSET, NormalBalance.DEBIT));

        Account changed = account.withStructure(AccountType.REVENUE, null);
        assertEquals(AccountType.REVENUE, changed.getAccountType());
        assertEquals(NormalBalance.CREDIT, changed.getNormalBalance());
        assertEquals(account.getCode(), changed.getCode());
    }

    @Test
    @DisplayName("An account cannot be its own parent")
    void testWithDetails_SelfParent() {
        Account account = Account.create("1100", "Cash", null, AccountType.ASSET, null, null);
        UUID ownId = account.getId();

        assertThrows(ValidationException.class, () -> account.withDetails(null, null, ownId));
        assertEquals("Petty Cash", account.withDetails("  Petty Cash ", null, null).getName());
    }
}
