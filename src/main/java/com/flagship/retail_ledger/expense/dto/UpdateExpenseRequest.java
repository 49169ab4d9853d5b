package com.flagship.retail_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.expense.ExpenseCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update: absent fields keep their current value.
 */
@Value
public class UpdateExpenseRequest {

    @JsonProperty("category")
    ExpenseCategory category;

    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @Size(max = 150, message = "Vendor must be at most 150 characters")
    @JsonProperty("vendor")
    String vendor;
}
