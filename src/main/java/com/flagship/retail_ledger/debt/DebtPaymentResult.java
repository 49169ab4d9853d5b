package com.flagship.retail_ledger.debt;

import com.flagship.retail_ledger.account.BalanceAccount;
import lombok.Value;

/**
 * Outcome of a debt payment. {@code account} is null when the payment was
 * recorded without moving money through a balance account.
 */
@Value
public class DebtPaymentResult {
    Debt debt;
    BalanceAccount account;
}
