package com.flagship.retail_ledger.fallback;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Report of a cash fallback check.
 *
 * When a fallback is configured its balance is always reported, whether or
 * not it can cover the amount, so a caller can show the exact shortfall on
 * both accounts.
 */
@Value
public class FallbackCheck {
    BigDecimal amount;
    UUID sourceAccountId;
    BigDecimal sourceBalance;
    boolean canPay;
    UUID fallbackAccountId;
    BigDecimal fallbackBalance;
    boolean fallbackAvailable;

    public boolean hasFallback() {
        return fallbackAccountId != null;
    }

    /**
     * The source cannot pay but the fallback can: the caller must confirm the switch.
     */
    public boolean requiresConfirmation() {
        return !canPay && fallbackAvailable;
    }

    public BigDecimal getShortfall() {
        return canPay ? BigDecimal.ZERO.setScale(amount.scale()) : amount.subtract(sourceBalance);
    }
}
