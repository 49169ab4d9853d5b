package com.flagship.retail_ledger.error;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The primary cash account cannot cover a payment but its configured
 * fallback can. The ledger never switches accounts on its own: the caller
 * has to resend the payment with {@code use_fallback=true}.
 */
public class NeedsFallbackConfirmationException extends LedgerException {

    private final UUID sourceAccountId;
    private final BigDecimal sourceBalance;
    private final UUID fallbackAccountId;
    private final BigDecimal fallbackBalance;

    public NeedsFallbackConfirmationException(UUID sourceAccountId, BigDecimal sourceBalance,
                                              UUID fallbackAccountId, BigDecimal fallbackBalance,
                                              BigDecimal requested) {
        super(String.format(
                "Source account balance %s does not cover %s; fallback account %s (balance %s) requires confirmation",
                sourceBalance.toPlainString(), requested.toPlainString(),
                fallbackAccountId, fallbackBalance.toPlainString()));
        this.sourceAccountId = sourceAccountId;
        this.sourceBalance = sourceBalance;
        this.fallbackAccountId = fallbackAccountId;
        this.fallbackBalance = fallbackBalance;
        addDetail("source_account_id", sourceAccountId);
        addDetail("source_balance", sourceBalance);
        addDetail("fallback_account_id", fallbackAccountId);
        addDetail("fallback_balance", fallbackBalance);
        addDetail("requested", requested);
    }

    public UUID getSourceAccountId() {
        return sourceAccountId;
    }

    public BigDecimal getSourceBalance() {
        return sourceBalance;
    }

    public UUID getFallbackAccountId() {
        return fallbackAccountId;
    }

    public BigDecimal getFallbackBalance() {
        return fallbackBalance;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.NEEDS_FALLBACK_CONFIRMATION;
    }
}
