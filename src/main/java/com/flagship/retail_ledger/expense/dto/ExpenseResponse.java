package com.flagship.retail_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.expense.Expense;
import com.flagship.retail_ledger.expense.ExpenseCategory;
import com.flagship.retail_ledger.expense.ExpenseStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("category")
    ExpenseCategory category;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("status")
    ExpenseStatus status;

    @JsonProperty("is_paid")
    boolean paid;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("vendor")
    String vendor;

    @JsonProperty("payment_account_id")
    UUID paymentAccountId;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .category(expense.getCategory())
            .description(expense.getDescription())
            .amount(expense.getAmount())
            .amountPaid(expense.getAmountPaid())
            .balance(expense.getBalance())
            .status(expense.getStatus())
            .paid(expense.isPaid())
            .expenseDate(expense.getExpenseDate())
            .dueDate(expense.getDueDate())
            .vendor(expense.getVendor())
            .paymentAccountId(expense.getPaymentAccountId())
            .paymentMethod(expense.getPaymentMethod())
            .paidAt(expense.getPaidAt())
            .createdAt(expense.getCreatedAt())
            .updatedAt(expense.getUpdatedAt())
            .build();
    }
}
