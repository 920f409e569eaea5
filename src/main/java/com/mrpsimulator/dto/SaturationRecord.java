package com.mrpsimulator.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SaturationRecord {
    String center;
    double requiredHours;
    double availableHours;
    double saturationPct;
    boolean bottleneck;
}
