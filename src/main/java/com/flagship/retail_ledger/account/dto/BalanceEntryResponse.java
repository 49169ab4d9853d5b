package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.account.BalanceEntry;
import com.flagship.retail_ledger.account.EntryType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BalanceEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceEntryResponse from(BalanceEntry entry) {
        return BalanceEntryResponse.builder()
            .id(entry.getId())
            .entryType(entry.getEntryType())
            .amount(entry.getAmount())
            .balanceAfter(entry.getBalanceAfter())
            .description(entry.getDescription())
            .reference(entry.getReference())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
