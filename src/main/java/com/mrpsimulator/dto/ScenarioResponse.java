package com.mrpsimulator.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ScenarioResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    long snapshotVersion;
    ScenarioRequest parameters;
    List<ManufacturingOrderLine> sequence;
    List<SaturationRecord> saturation;
    Kpis kpis;
    List<SaturationRecord> bottlenecks;
    Warnings warnings;

    @Value
    @Builder
    public static class Kpis {
        int urgentArticles;
        int totalOrders;
        double averageSaturation;
        int bottleneckCount;
        double totalRequiredHours;
        int activeCenters;
    }

    @Value
    @Builder
    public static class Warnings {
        int failedUnits;
        List<UnitFailure> failures;
        List<String> unroutedArticles;
    }
}
