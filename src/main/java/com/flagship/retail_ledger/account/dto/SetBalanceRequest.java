package com.flagship.retail_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Administrative balance override. The reason is kept in the account journal.
 */
@Value
public class SetBalanceRequest {

    @NotNull(message = "Balance is required")
    @JsonProperty("balance")
    BigDecimal balance;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
