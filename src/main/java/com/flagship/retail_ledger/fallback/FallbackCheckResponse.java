package com.flagship.retail_ledger.fallback;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class FallbackCheckResponse {

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("source_balance")
    BigDecimal sourceBalance;

    @JsonProperty("can_pay")
    boolean canPay;

    @JsonProperty("shortfall")
    BigDecimal shortfall;

    @JsonProperty("fallback_account_id")
    UUID fallbackAccountId;

    @JsonProperty("fallback_balance")
    BigDecimal fallbackBalance;

    @JsonProperty("fallback_available")
    boolean fallbackAvailable;

    @JsonProperty("requires_confirmation")
    boolean requiresConfirmation;

    public static FallbackCheckResponse from(FallbackCheck check) {
        return FallbackCheckResponse.builder()
            .amount(check.getAmount())
            .sourceAccountId(check.getSourceAccountId())
            .sourceBalance(check.getSourceBalance())
            .canPay(check.isCanPay())
            .shortfall(check.getShortfall())
            .fallbackAccountId(check.getFallbackAccountId())
            .fallbackBalance(check.getFallbackBalance())
            .fallbackAvailable(check.isFallbackAvailable())
            .requiresConfirmation(check.requiresConfirmation())
            .build();
    }
}
