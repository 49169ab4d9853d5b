package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.account.BalanceAccount;
import lombok.Value;

/**
 * Outcome of a successful expense payment: the updated expense, the
 * allocation written for it and the account that was actually debited.
 */
@Value
public class ExpensePaymentResult {
    Expense expense;
    ExpensePayment payment;
    BalanceAccount account;
    boolean fallbackUsed;
}
