package com.flagship.retail_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request to pay (part of) an expense.
 *
 * A cash payment that the account cannot cover is answered with
 * NEEDS_FALLBACK_CONFIRMATION; the caller confirms by resending the same
 * request with {@code use_fallback=true}.
 */
@Value
public class PayExpenseRequest {

    // scale is checked by the ledger so that it answers with its own message
    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("use_fallback")
    boolean useFallback;

    @JsonProperty("fallback_account_id")
    UUID fallbackAccountId;
}
