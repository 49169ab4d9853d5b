package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Income entering the ledger. The payment method picks the receiving
 * account when none is given in the path.
 */
@Value
public class RecordIncomeRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @NotBlank(message = "Description is required")
    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;
}
