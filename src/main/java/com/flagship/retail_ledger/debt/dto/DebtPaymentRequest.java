package com.flagship.retail_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payment of a receivable or payable. With {@code account_id} the money
 * moves through that balance account.
 */
@Value
public class DebtPaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("account_id")
    UUID accountId;
}
