package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.common.PaymentMethod;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for expenses.
 *
 * Separated from the domain object; state changes go through
 * {@link #updateFromDomain} so the domain invariants run first.
 */
@Entity
@Table(
    name = "expenses",
    indexes = {
        @Index(name = "idx_expenses_due_date", columnList = "due_date"),
        @Index(name = "idx_expenses_payment_account", columnList = "payment_account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ExpenseCategory category;

    @Column(nullable = false, length = 255)
    private String description;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(length = 150)
    private String vendor;

    @Column(name = "payment_account_id")
    private UUID paymentAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ExpenseEntity fromDomain(Expense expense) {
        return new ExpenseEntity(
            expense.getId(),
            expense.getCategory(),
            expense.getDescription(),
            expense.getAmount(),
            expense.getAmountPaid(),
            expense.getExpenseDate(),
            expense.getDueDate(),
            expense.getVendor(),
            expense.getPaymentAccountId(),
            expense.getPaymentMethod(),
            expense.getPaidAt(),
            0L,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    Expense toDomain() {
        return new Expense(id, category, description, amount, amountPaid, expenseDate, dueDate, vendor,
            paymentAccountId, paymentMethod, paidAt, createdAt, updatedAt);
    }

    void updateFromDomain(Expense expense) {
        if (!this.id.equals(expense.getId())) {
            throw new IllegalArgumentException("Cannot update expense " + id + " from " + expense.getId());
        }
        this.category = expense.getCategory();
        this.description = expense.getDescription();
        this.amount = expense.getAmount();
        this.amountPaid = expense.getAmountPaid();
        this.expenseDate = expense.getExpenseDate();
        this.dueDate = expense.getDueDate();
        this.vendor = expense.getVendor();
        this.paymentAccountId = expense.getPaymentAccountId();
        this.paymentMethod = expense.getPaymentMethod();
        this.paidAt = expense.getPaidAt();
    }
}
