package com.mrpsimulator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DataSnapshot {
    long version;
    Instant loadedAt;
    String source;
    List<DemandOrder> orders;
    List<RoutingStep> routingSteps;
    List<StockLevel> stock;
    List<WipRecord> wip;
    List<LotRule> lotRules;
    List<CenterCapacity> centerCapacity;
}
