package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.account.TransferResult;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TransferResponse {

    @JsonProperty("reference")
    String reference;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("from")
    AccountResponse from;

    @JsonProperty("to")
    AccountResponse to;

    public static TransferResponse from(TransferResult result) {
        return new TransferResponse(result.getReference(), result.getAmount(),
            AccountResponse.from(result.getFrom()), AccountResponse.from(result.getTo()));
    }
}
