package com.mrpsimulator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CenterCapacity {
    @NotBlank(message = "center is required")
    String center;

    @DecimalMin(value = "0.0", message = "availableHours must be >= 0")
    double availableHours;
}
