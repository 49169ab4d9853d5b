package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.account.BalanceAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(BalanceAccount account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .kind(account.getKind())
            .balance(account.getBalance())
            .active(account.isActive())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
