package com.flagship.retail_ledger.common;

import com.flagship.retail_ledger.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    @DisplayName("Amounts are normalized to two decimals without rounding")
    void testRequirePositive_NormalizesScale() {
        assertEquals("80000.00", Amounts.requirePositive(new BigDecimal("80000"), "amount").toPlainString());
        assertEquals("12.50", Amounts.requirePositive(new BigDecimal("12.5"), "amount").toPlainString());
        assertEquals("12.50", Amounts.requirePositive(new BigDecimal("12.5000"), "amount").toPlainString());
    }

    @Test
    @DisplayName("More than two decimals is rejected, never rounded")
    void testRequirePositive_RejectsThirdDecimal() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> Amounts.requirePositive(new BigDecimal("10.005"), "amount"));
        assertEquals("amount", e.getDetails().get("field"));
    }

    @Test
    @DisplayName("Zero, negative and missing amounts are rejected")
    void testRequirePositive_RejectsNonPositive() {
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(BigDecimal.ZERO, "amount"));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(new BigDecimal("-1"), "amount"));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(null, "amount"));
    }

    @Test
    @DisplayName("Exact amounts may be negative")
    void testRequireExact_AllowsNegative() {
        assertEquals("-150.00", Amounts.requireExact(new BigDecimal("-150"), "balance").toPlainString());
    }
}
