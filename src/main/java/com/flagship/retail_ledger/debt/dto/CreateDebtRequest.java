package com.flagship.retail_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class CreateDebtRequest {

    @NotBlank(message = "Description is required")
    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 150, message = "Counterparty must be at most 150 characters")
    @JsonProperty("counterparty")
    String counterparty;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @JsonProperty("due_date")
    LocalDate dueDate;
}
