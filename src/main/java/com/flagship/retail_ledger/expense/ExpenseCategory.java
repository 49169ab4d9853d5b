package com.flagship.retail_ledger.expense;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ExpenseCategory {
    RENT("rent"),
    UTILITIES("utilities"),
    PAYROLL("payroll"),
    SUPPLIES("supplies"),
    INVENTORY("inventory"),
    TRANSPORT("transport"),
    MAINTENANCE("maintenance"),
    MARKETING("marketing"),
    TAXES("taxes"),
    BANK_FEES("bank_fees"),
    OTHER("other");

    private final String value;

    ExpenseCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ExpenseCategory fromValue(String value) {
        return Arrays.stream(values())
            .filter(category -> category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown expense category: " + value));
    }
}
