package com.flagship.retail_ledger.adjustment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.adjustment.AdjustmentReason;
import com.flagship.retail_ledger.adjustment.AdjustmentRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AdjustmentResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("expense_id")
    UUID expenseId;

    @JsonProperty("reason")
    AdjustmentReason reason;

    @JsonProperty("previous_amount")
    BigDecimal previousAmount;

    @JsonProperty("new_amount")
    BigDecimal newAmount;

    @JsonProperty("adjustment_delta")
    BigDecimal adjustmentDelta;

    @JsonProperty("previous_amount_paid")
    BigDecimal previousAmountPaid;

    @JsonProperty("new_amount_paid")
    BigDecimal newAmountPaid;

    @JsonProperty("previous_account_id")
    UUID previousAccountId;

    @JsonProperty("new_account_id")
    UUID newAccountId;

    @JsonProperty("description")
    String description;

    @JsonProperty("adjusted_by")
    String adjustedBy;

    @JsonProperty("adjusted_at")
    Instant adjustedAt;

    public static AdjustmentResponse from(AdjustmentRecord record) {
        return AdjustmentResponse.builder()
            .id(record.getId())
            .expenseId(record.getExpenseId())
            .reason(record.getReason())
            .previousAmount(record.getPreviousAmount())
            .newAmount(record.getNewAmount())
            .adjustmentDelta(record.getAdjustmentDelta())
            .previousAmountPaid(record.getPreviousAmountPaid())
            .newAmountPaid(record.getNewAmountPaid())
            .previousAccountId(record.getPreviousAccountId())
            .newAccountId(record.getNewAccountId())
            .description(record.getDescription())
            .adjustedBy(record.getAdjustedBy())
            .adjustedAt(record.getAdjustedAt())
            .build();
    }
}
