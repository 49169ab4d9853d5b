package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.common.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One allocation of money from an account to an expense. Reversals and
 * account moves deactivate allocations instead of deleting them.
 */
@Value
public class ExpensePayment {
    Long id;
    UUID expenseId;
    UUID accountId;
    BigDecimal amount;
    PaymentMethod method;
    Instant paidAt;
    boolean active;
}
