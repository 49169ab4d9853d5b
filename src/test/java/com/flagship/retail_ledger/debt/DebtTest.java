package com.flagship.retail_ledger.debt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DebtTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 10, 15);

    private Debt payable(LocalDate dueDate) {
        return Debt.create(UUID.randomUUID(), DebtKind.PAYABLE, "Zippers order", "Cremalleras SA",
            new BigDecimal("500.00"), TODAY.minusDays(30), dueDate);
    }

    @Test
    @DisplayName("Overdue only when the due date has passed and a balance remains")
    void testIsOverdue() {
        assertTrue(payable(TODAY.minusDays(1)).isOverdue(TODAY));
        assertFalse(payable(TODAY).isOverdue(TODAY));
        assertFalse(payable(null).isOverdue(TODAY));

        Debt settled = payable(TODAY.minusDays(1)).applyPayment(new BigDecimal("500.00"), Instant.now());
        assertFalse(settled.isOverdue(TODAY));
    }

    @Test
    @DisplayName("Payments accumulate and the settling one stamps paidAt")
    void testApplyPayment() {
        Instant at = Instant.parse("2024-10-15T12:00:00Z");
        Debt partly = payable(null).applyPayment(new BigDecimal("200.00"), at);

        assertEquals(new BigDecimal("300.00"), partly.getBalance());
        assertFalse(partly.isPaid());
        assertNull(partly.getPaidAt());

        Debt paid = partly.applyPayment(new BigDecimal("300.00"), at);
        assertTrue(paid.isPaid());
        assertEquals(at, paid.getPaidAt());
        assertThrows(IllegalArgumentException.class, () -> paid.applyPayment(new BigDecimal("0.01"), at));
    }
}
