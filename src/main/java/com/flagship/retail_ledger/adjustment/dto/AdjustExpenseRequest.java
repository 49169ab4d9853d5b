package com.flagship.retail_ledger.adjustment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.adjustment.AdjustmentReason;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Correction of a paid expense. At least one of {@code new_amount} and
 * {@code new_account_id} must differ from the current state; the reason is
 * normalized from what changes.
 */
@Value
public class AdjustExpenseRequest {

    @DecimalMin(value = "0.01", message = "New amount must be greater than 0")
    @JsonProperty("new_amount")
    BigDecimal newAmount;

    @JsonProperty("new_account_id")
    UUID newAccountId;

    @JsonProperty("reason")
    AdjustmentReason reason;

    @NotBlank(message = "Description is required")
    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 100, message = "Adjusted by must be at most 100 characters")
    @JsonProperty("adjusted_by")
    String adjustedBy;
}
