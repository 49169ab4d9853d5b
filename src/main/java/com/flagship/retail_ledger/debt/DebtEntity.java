package com.flagship.retail_ledger.debt;

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
 * JPA entity for receivables and payables, one table with a kind column.
 */
@Entity
@Table(
    name = "debts",
    indexes = {
        @Index(name = "idx_debts_kind_due_date", columnList = "kind, due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DebtEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private DebtKind kind;

    @Column(nullable = false, length = 255)
    private String description;

    @Column(length = 150)
    private String counterparty;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "invoice_date", nullable = false)
    private LocalDate invoiceDate;

    @Column(name = "due_date")
    private LocalDate dueDate;

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

    static DebtEntity fromDomain(Debt debt) {
        return new DebtEntity(
            debt.getId(),
            debt.getKind(),
            debt.getDescription(),
            debt.getCounterparty(),
            debt.getAmount(),
            debt.getAmountPaid(),
            debt.getInvoiceDate(),
            debt.getDueDate(),
            debt.getPaidAt(),
            0L,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    Debt toDomain() {
        return new Debt(id, kind, description, counterparty, amount, amountPaid, invoiceDate, dueDate, paidAt,
            createdAt, updatedAt);
    }

    /**
     * Payments are the only change a debt accepts.
     */
    void updateFromDomain(Debt debt) {
        if (!this.id.equals(debt.getId())) {
            throw new IllegalArgumentException("Cannot update debt " + id + " from " + debt.getId());
        }
        this.amountPaid = debt.getAmountPaid();
        this.paidAt = debt.getPaidAt();
    }
}
