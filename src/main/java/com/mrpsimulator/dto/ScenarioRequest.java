package com.mrpsimulator.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ScenarioRequest {

    @DecimalMin(value = "0.0", inclusive = false, message = "saturationFactor must be > 0")
    @Builder.Default
    double saturationFactor = 1.0;

    @Builder.Default
    boolean extraShift = false;

    @Min(value = 1, message = "horizonDays must be >= 1")
    @Builder.Default
    int horizonDays = 30;
}
