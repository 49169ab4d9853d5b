package com.flagship.retail_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.expense.ExpensePayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ExpensePaymentResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("expense_id")
    UUID expenseId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("paid_at")
    Instant paidAt;

    public static ExpensePaymentResponse from(ExpensePayment payment) {
        return ExpensePaymentResponse.builder()
            .id(payment.getId())
            .expenseId(payment.getExpenseId())
            .accountId(payment.getAccountId())
            .amount(payment.getAmount())
            .method(payment.getMethod())
            .paidAt(payment.getPaidAt())
            .build();
    }
}
