package com.flagship.retail_ledger.account;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of a balance account.
 *
 * Funds kinds hold spendable money and can never be driven negative by a
 * ledger debit. Cash kinds are the drawers that take part in the
 * primary/fallback check before a cash payment.
 */
public enum AccountKind {
    CASH_PRIMARY("cash_primary"),
    CASH_SECONDARY("cash_secondary"),
    DIGITAL_WALLET("digital_wallet"),
    BANK("bank"),
    ASSET_FIXED("asset_fixed"),
    ASSET_OTHER("asset_other"),
    LIABILITY_CURRENT("liability_current"),
    LIABILITY_LONG("liability_long"),
    EQUITY("equity");

    private final String value;

    AccountKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AccountKind fromValue(String value) {
        return Arrays.stream(values())
            .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown account kind: " + value));
    }

    public boolean isCash() {
        return this == CASH_PRIMARY || this == CASH_SECONDARY;
    }

    public boolean isFunds() {
        return isCash() || this == DIGITAL_WALLET || this == BANK;
    }
}
