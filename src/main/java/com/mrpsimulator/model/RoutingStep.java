package com.mrpsimulator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

// setupTime in hours; a zero hourlyRate is accepted and guarded when planning
@Value
@Builder
@Jacksonized
public class RoutingStep {
    @NotBlank(message = "article is required")
    String article;

    int sequence;

    @NotBlank(message = "center is required")
    String center;

    @DecimalMin(value = "0.0", message = "setupTime must be >= 0")
    double setupTime;

    @DecimalMin(value = "0.0", message = "hourlyRate must be >= 0")
    double hourlyRate;
}
