package com.flagship.retail_ledger.adjustment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for adjustment records.
 *
 * Every column is {@code updatable = false} and there is no update method:
 * once written, a record can only be read.
 */
@Entity
@Table(
    name = "adjustment_records",
    indexes = {
        @Index(name = "idx_adjustment_records_expense", columnList = "expense_id"),
        @Index(name = "idx_adjustment_records_adjusted_at", columnList = "adjusted_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AdjustmentRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "expense_id", nullable = false, updatable = false)
    private UUID expenseId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private AdjustmentReason reason;

    @Column(name = "previous_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal previousAmount;

    @Column(name = "new_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal newAmount;

    @Column(name = "adjustment_delta", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal adjustmentDelta;

    @Column(name = "previous_amount_paid", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal previousAmountPaid;

    @Column(name = "new_amount_paid", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal newAmountPaid;

    @Column(name = "previous_account_id", updatable = false)
    private UUID previousAccountId;

    @Column(name = "new_account_id", updatable = false)
    private UUID newAccountId;

    @Column(nullable = false, updatable = false, length = 500)
    private String description;

    @Column(name = "adjusted_by", updatable = false, length = 100)
    private String adjustedBy;

    @Column(name = "adjusted_at", nullable = false, updatable = false)
    private Instant adjustedAt;

    @PrePersist
    void onCreate() {
        if (this.adjustedAt == null) {
            this.adjustedAt = Instant.now();
        }
    }

    static AdjustmentRecordEntity fromDomain(AdjustmentRecord record) {
        return new AdjustmentRecordEntity(
            null, // id - generated by the database
            record.getExpenseId(),
            record.getReason(),
            record.getPreviousAmount(),
            record.getNewAmount(),
            record.getAdjustmentDelta(),
            record.getPreviousAmountPaid(),
            record.getNewAmountPaid(),
            record.getPreviousAccountId(),
            record.getNewAccountId(),
            record.getDescription(),
            record.getAdjustedBy(),
            record.getAdjustedAt()
        );
    }

    AdjustmentRecord toDomain() {
        return AdjustmentRecord.builder()
            .id(id)
            .expenseId(expenseId)
            .reason(reason)
            .previousAmount(previousAmount)
            .newAmount(newAmount)
            .adjustmentDelta(adjustmentDelta)
            .previousAmountPaid(previousAmountPaid)
            .newAmountPaid(newAmountPaid)
            .previousAccountId(previousAccountId)
            .newAccountId(newAccountId)
            .description(description)
            .adjustedBy(adjustedBy)
            .adjustedAt(adjustedAt)
            .build();
    }
}
