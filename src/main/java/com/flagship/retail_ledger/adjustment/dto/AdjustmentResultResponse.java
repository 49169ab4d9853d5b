package com.flagship.retail_ledger.adjustment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.adjustment.AdjustmentResult;
import com.flagship.retail_ledger.expense.dto.ExpenseResponse;
import lombok.Value;

@Value
public class AdjustmentResultResponse {

    @JsonProperty("expense")
    ExpenseResponse expense;

    @JsonProperty("adjustment")
    AdjustmentResponse adjustment;

    public static AdjustmentResultResponse from(AdjustmentResult result) {
        return new AdjustmentResultResponse(
            ExpenseResponse.from(result.getExpense()),
            AdjustmentResponse.from(result.getRecord()));
    }
}
