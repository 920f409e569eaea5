package com.mrpsimulator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LotRule {
    @NotBlank(message = "article is required")
    String article;

    @DecimalMin(value = "0.0", inclusive = false, message = "lotSize must be > 0")
    double lotSize;
}
