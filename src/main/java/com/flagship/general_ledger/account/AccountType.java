package com.flagship.general_ledger.account;

public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    REVENUE,
    COGS,
    EXPENSE;

    /**
     * Natural side for the type. Contra accounts (e.g. accumulated depreciation)
     * override it explicitly at creation.
     */
    public NormalBalance naturalBalance() {
        return switch (this) {
            case ASSET, COGS, EXPENSE -> NormalBalance.DEBIT;
            case LIABILITY, EQUITY, REVENUE -> NormalBalance.CREDIT;
        };
    }
}
