package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class TransferRequest {

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @NotNull(message = "To account ID is required")
    @JsonProperty("to_account_id")
    UUID toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;
}
