package com.flagship.retail_ledger.error;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit would drive a funds account (cash, wallet, bank) below zero.
 *
 * When a fallback account was considered, its balance is reported too so
 * the caller can show the exact shortfall on both accounts.
 */
public class InsufficientFundsException extends LedgerException {

    private final UUID accountId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(UUID accountId, String accountName,
                                      BigDecimal available, BigDecimal requested) {
        this(accountId, accountName, available, requested, null, null);
    }

    public InsufficientFundsException(UUID accountId, String accountName,
                                      BigDecimal available, BigDecimal requested,
                                      UUID fallbackAccountId, BigDecimal fallbackBalance) {
        super(String.format("Insufficient funds in %s: available=%s, requested=%s",
                accountName, available.toPlainString(), requested.toPlainString()));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
        addDetail("account_id", accountId);
        addDetail("source_balance", available);
        addDetail("requested", requested);
        addDetail("shortfall", requested.subtract(available));
        addDetail("fallback_account_id", fallbackAccountId);
        addDetail("fallback_balance", fallbackBalance);
    }

    public UUID getAccountId() {
        return accountId;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.INSUFFICIENT_FUNDS;
    }
}
