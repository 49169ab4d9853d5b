package com.flagship.retail_ledger.debt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DebtKind {
    /**
     * Owed to the business by a customer. Collecting it credits an account.
     */
    RECEIVABLE("receivable"),

    /**
     * Owed by the business to a supplier. Paying it debits an account.
     */
    PAYABLE("payable");

    private final String value;

    DebtKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DebtKind fromValue(String value) {
        return Arrays.stream(values())
            .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown debt kind: " + value));
    }
}
