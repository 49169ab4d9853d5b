package com.flagship.retail_ledger.adjustment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AdjustmentReason {
    AMOUNT_CORRECTION("amount_correction"),
    ACCOUNT_CORRECTION("account_correction"),
    BOTH_CORRECTION("both_correction"),
    /**
     * Written only by a full reversal; never accepted as an adjustment reason.
     */
    ERROR_REVERSAL("error_reversal"),
    PARTIAL_REFUND("partial_refund");

    private final String value;

    AdjustmentReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AdjustmentReason fromValue(String value) {
        return Arrays.stream(values())
            .filter(reason -> reason.value.equalsIgnoreCase(value) || reason.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown adjustment reason: " + value));
    }
}
