package com.flagship.retail_ledger.account;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class TransferResult {
    String reference;
    BigDecimal amount;
    BalanceAccount from;
    BalanceAccount to;
}
