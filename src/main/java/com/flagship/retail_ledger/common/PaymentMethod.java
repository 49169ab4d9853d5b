package com.flagship.retail_ledger.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.retail_ledger.account.AccountKind;

import java.util.Arrays;

/**
 * How money left or entered an account.
 */
public enum PaymentMethod {
    CASH("cash"),
    TRANSFER("transfer"),
    CARD("card"),
    CREDIT("credit"),
    OTHER("other");

    private final String value;

    PaymentMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PaymentMethod fromValue(String value) {
        return Arrays.stream(values())
            .filter(method -> method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown payment method: " + value));
    }

    /**
     * Method assumed when the caller does not state one: cash drawers pay
     * in cash, everything else by transfer.
     */
    public static PaymentMethod defaultFor(AccountKind kind) {
        return kind.isCash() ? CASH : TRANSFER;
    }
}
