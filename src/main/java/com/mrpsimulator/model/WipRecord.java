package com.mrpsimulator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class WipRecord {
    @NotBlank(message = "article is required")
    String article;

    @DecimalMin(value = "0.0", message = "quantity must be >= 0")
    double quantity;
}
