package com.flagship.retail_ledger.common;

import com.flagship.retail_ledger.error.ValidationException;

import java.math.BigDecimal;

/**
 * Monetary amount rules shared by every ledger operation.
 *
 * Amounts carry at most two decimals. Anything finer is rejected instead of
 * being rounded, so repeated partial payments can never drift.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {
        // Utility class
    }

    /**
     * Validates a strictly positive amount and normalizes it to scale 2.
     *
     * @throws ValidationException if the amount is null, not positive or has more than two decimals
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field, field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new ValidationException(field, field + " must be greater than 0");
        }
        return normalize(amount, field);
    }

    /**
     * Validates an amount of any sign and normalizes it to scale 2.
     */
    public static BigDecimal requireExact(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field, field + " is required");
        }
        return normalize(amount, field);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }

    private static BigDecimal normalize(BigDecimal amount, String field) {
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > SCALE) {
            throw new ValidationException(field,
                    field + " must not have more than " + SCALE + " decimals: " + amount.toPlainString());
        }
        // Exact: the scale only grows here, no rounding can happen
        return amount.setScale(SCALE);
    }
}
