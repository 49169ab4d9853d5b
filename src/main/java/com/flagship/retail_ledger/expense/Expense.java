package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.common.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Expense domain object.
 *
 * Key principles:
 * - {@code 0 <= amountPaid <= amount} and {@code amount > 0} hold for every instance
 * - Status is derived from the two amounts, never stored
 * - State changes are immutable (each transition returns a new Expense)
 *
 * Payment account, method and paid-at describe the settling payment and are
 * only present while the expense is paid.
 */
@Value
public class Expense {
    UUID id;
    ExpenseCategory category;
    String description;
    BigDecimal amount;
    BigDecimal amountPaid;
    LocalDate expenseDate;
    LocalDate dueDate;
    String vendor;
    UUID paymentAccountId;
    PaymentMethod paymentMethod;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    public Expense(UUID id, ExpenseCategory category, String description, BigDecimal amount, BigDecimal amountPaid,
                   LocalDate expenseDate, LocalDate dueDate, String vendor, UUID paymentAccountId,
                   PaymentMethod paymentMethod, Instant paidAt, Instant createdAt, Instant updatedAt) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Expense amount must be positive: " + amount);
        }
        if (amountPaid == null || amountPaid.signum() < 0 || amountPaid.compareTo(amount) > 0) {
            throw new IllegalArgumentException(
                String.format("Amount paid %s must be between 0 and the expense amount %s", amountPaid, amount));
        }
        this.id = id;
        this.category = category;
        this.description = description;
        this.amount = amount;
        this.amountPaid = amountPaid;
        this.expenseDate = expenseDate;
        this.dueDate = dueDate;
        this.vendor = vendor;
        this.paymentAccountId = paymentAccountId;
        this.paymentMethod = paymentMethod;
        this.paidAt = paidAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Creates a new Expense in PENDING status.
     */
    public static Expense create(UUID id, ExpenseCategory category, String description, BigDecimal amount,
                                 LocalDate expenseDate, LocalDate dueDate, String vendor) {
        Instant now = Instant.now();
        return new Expense(id, category, description, amount, BigDecimal.ZERO.setScale(amount.scale()),
            expenseDate, dueDate, vendor, null, null, null, now, now);
    }

    public BigDecimal getBalance() {
        return amount.subtract(amountPaid);
    }

    public boolean isPaid() {
        return amountPaid.compareTo(amount) >= 0;
    }

    public ExpenseStatus getStatus() {
        if (amountPaid.signum() == 0) {
            return ExpenseStatus.PENDING;
        }
        return isPaid() ? ExpenseStatus.PAID : ExpenseStatus.PARTIALLY_PAID;
    }

    /**
     * Records a payment. When the balance reaches zero the paying account and
     * method become the settling ones.
     *
     * @throws IllegalArgumentException if the payment exceeds the balance
     */
    public Expense applyPayment(BigDecimal payment, UUID accountId, PaymentMethod method, Instant at) {
        if (payment.signum() <= 0 || payment.compareTo(getBalance()) > 0) {
            throw new IllegalArgumentException(
                String.format("Payment %s must be positive and at most the balance %s", payment, getBalance()));
        }
        BigDecimal newPaid = amountPaid.add(payment);
        boolean settles = newPaid.compareTo(amount) == 0;
        return new Expense(id, category, description, amount, newPaid, expenseDate, dueDate, vendor,
            settles ? accountId : null,
            settles ? method : null,
            settles ? at : null,
            createdAt, Instant.now());
    }

    /**
     * Edits the descriptive fields. The amount may only change while nothing
     * has been paid.
     */
    public Expense withDetails(ExpenseCategory newCategory, String newDescription, BigDecimal newAmount,
                               LocalDate newExpenseDate, LocalDate newDueDate, String newVendor) {
        if (newAmount.compareTo(amount) != 0 && amountPaid.signum() > 0) {
            throw new IllegalStateException(
                String.format("Cannot change the amount of expense %s in %s status", id, getStatus()));
        }
        return new Expense(id, newCategory, newDescription, newAmount, amountPaid, newExpenseDate, newDueDate,
            newVendor, paymentAccountId, paymentMethod, paidAt, createdAt, Instant.now());
    }

    /**
     * Applies the outcome of an audited correction. A paid expense stays paid
     * (its amount paid follows the amount); {@code settlingAccountId} and
     * {@code method} are recorded when the result is paid.
     */
    public Expense corrected(BigDecimal newAmount, BigDecimal newAmountPaid, UUID settlingAccountId,
                             PaymentMethod method, Instant at) {
        if (isPaid() && newAmountPaid.compareTo(newAmount) != 0) {
            throw new IllegalStateException(
                String.format("Paid expense %s cannot become partially paid", id));
        }
        boolean settled = newAmountPaid.compareTo(newAmount) == 0;
        return new Expense(id, category, description, newAmount, newAmountPaid, expenseDate, dueDate, vendor,
            settled ? settlingAccountId : null,
            settled ? method : null,
            settled ? (paidAt != null ? paidAt : at) : null,
            createdAt, Instant.now());
    }

    /**
     * Transitions the expense back to PENDING.
     *
     * @throws IllegalStateException if nothing has been paid
     */
    public Expense reverted() {
        if (amountPaid.signum() == 0) {
            throw new IllegalStateException(
                String.format("Cannot revert expense %s in %s status", id, getStatus()));
        }
        return new Expense(id, category, description, amount, BigDecimal.ZERO.setScale(amountPaid.scale()),
            expenseDate, dueDate, vendor, null, null, null, createdAt, Instant.now());
    }
}
