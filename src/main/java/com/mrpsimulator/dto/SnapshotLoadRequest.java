package com.mrpsimulator.dto;

import com.mrpsimulator.model.CenterCapacity;
import com.mrpsimulator.model.DemandOrder;
import com.mrpsimulator.model.LotRule;
import com.mrpsimulator.model.RoutingStep;
import com.mrpsimulator.model.StockLevel;
import com.mrpsimulator.model.WipRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

// A null table is absent and fails the load with a schema error; an empty one is valid.
@Value
@Builder
@Jacksonized
public class SnapshotLoadRequest {
    List<@NotNull(message = "row must not be null") @Valid DemandOrder> orders;
    List<@NotNull(message = "row must not be null") @Valid RoutingStep> routingSteps;
    List<@NotNull(message = "row must not be null") @Valid StockLevel> stock;
    List<@NotNull(message = "row must not be null") @Valid WipRecord> wip;
    List<@NotNull(message = "row must not be null") @Valid LotRule> lotRules;
    List<@NotNull(message = "row must not be null") @Valid CenterCapacity> centerCapacity;
}
