package com.flagship.retail_ledger.expense;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Payment status of an expense, derived from amount and amount paid.
 *
 * Transitions:
 * - PENDING → PARTIALLY_PAID / PAID through payments
 * - PARTIALLY_PAID → PAID through payments or an amount correction
 * - PAID → PENDING only through a full reversal; never to PARTIALLY_PAID
 */
public enum ExpenseStatus {
    /**
     * Nothing paid yet. Initial state of every expense.
     */
    PENDING("pending"),

    /**
     * Some payments recorded, balance still above zero.
     */
    PARTIALLY_PAID("partially_paid"),

    /**
     * Balance is zero.
     */
    PAID("paid");

    private final String value;

    ExpenseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ExpenseStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown expense status: " + value));
    }
}
