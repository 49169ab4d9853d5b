package com.flagship.retail_ledger.adjustment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one correction, reversal or refund of a paid expense.
 * Records are append-only.
 */
@Value
@Builder
public class AdjustmentRecord {
    Long id;
    UUID expenseId;
    AdjustmentReason reason;
    BigDecimal previousAmount;
    BigDecimal newAmount;
    BigDecimal adjustmentDelta;
    BigDecimal previousAmountPaid;
    BigDecimal newAmountPaid;
    UUID previousAccountId;
    UUID newAccountId;
    String description;
    String adjustedBy;
    Instant adjustedAt;
}
