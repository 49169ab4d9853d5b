package com.flagship.retail_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Value of the stock on hand. {@code estimatedValue} is the part valued from
 * sale prices because no cost was recorded; it is included in {@code total}.
 */
@Value
public class InventoryValuation {
    BigDecimal total;
    BigDecimal estimatedValue;
    int itemCount;
    int estimatedItemCount;

    public boolean isEstimated() {
        return estimatedItemCount > 0;
    }
}
