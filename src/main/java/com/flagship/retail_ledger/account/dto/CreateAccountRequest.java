package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.account.AccountKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 20, message = "Code must be at most 20 characters")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;
}
