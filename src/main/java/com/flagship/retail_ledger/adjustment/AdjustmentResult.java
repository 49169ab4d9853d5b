package com.flagship.retail_ledger.adjustment;

import com.flagship.retail_ledger.expense.Expense;
import lombok.Value;

@Value
public class AdjustmentResult {
    Expense expense;
    AdjustmentRecord record;
}
