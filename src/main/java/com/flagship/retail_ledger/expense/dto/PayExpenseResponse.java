package com.flagship.retail_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.expense.ExpensePaymentResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class PayExpenseResponse {

    @JsonProperty("expense")
    ExpenseResponse expense;

    @JsonProperty("payment")
    ExpensePaymentResponse payment;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("account_balance")
    BigDecimal accountBalance;

    @JsonProperty("fallback_used")
    boolean fallbackUsed;

    public static PayExpenseResponse from(ExpensePaymentResult result) {
        return PayExpenseResponse.builder()
            .expense(ExpenseResponse.from(result.getExpense()))
            .payment(ExpensePaymentResponse.from(result.getPayment()))
            .accountId(result.getAccount().getId())
            .accountBalance(result.getAccount().getBalance())
            .fallbackUsed(result.isFallbackUsed())
            .build();
    }
}
