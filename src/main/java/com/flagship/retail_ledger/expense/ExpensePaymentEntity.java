package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.common.PaymentMethod;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "expense_payments",
    indexes = {
        @Index(name = "idx_expense_payments_expense", columnList = "expense_id"),
        @Index(name = "idx_expense_payments_account", columnList = "account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExpensePaymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "expense_id", nullable = false, updatable = false)
    private UUID expenseId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PaymentMethod method;

    @Column(name = "paid_at", nullable = false, updatable = false)
    private Instant paidAt;

    @Column(nullable = false)
    private boolean active;

    static ExpensePaymentEntity allocate(UUID expenseId, UUID accountId, BigDecimal amount,
                                         PaymentMethod method, Instant paidAt) {
        ExpensePaymentEntity entity = new ExpensePaymentEntity();
        entity.expenseId = expenseId;
        entity.accountId = accountId;
        entity.amount = amount;
        entity.method = method;
        entity.paidAt = paidAt;
        entity.active = true;
        return entity;
    }

    /**
     * The only mutation an allocation allows: once money went back to the
     * account the row stays as history.
     */
    void deactivate() {
        this.active = false;
    }

    ExpensePayment toDomain() {
        return new ExpensePayment(id, expenseId, accountId, amount, method, paidAt, active);
    }
}
