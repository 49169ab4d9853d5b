package com.flagship.retail_ledger.adjustment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RevertExpenseRequest {

    @NotBlank(message = "Description is required")
    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 100, message = "Adjusted by must be at most 100 characters")
    @JsonProperty("adjusted_by")
    String adjustedBy;
}
