package com.mrpsimulator.service;

import com.mrpsimulator.dto.ManufacturingOrderLine;

import java.util.List;
import java.util.Map;

public record WorkerResult(
    int orderIndex,
    String article,
    boolean inHorizon,
    boolean unrouted,
    List<ManufacturingOrderLine> lines,
    Map<String, Double> centerLoad
) {

    static WorkerResult outsideHorizon(int orderIndex, String article) {
        return new WorkerResult(orderIndex, article, false, false, List.of(), Map.of());
    }

    static WorkerResult covered(int orderIndex, String article) {
        return new WorkerResult(orderIndex, article, true, false, List.of(), Map.of());
    }

    static WorkerResult unrouted(int orderIndex, String article) {
        return new WorkerResult(orderIndex, article, true, true, List.of(), Map.of());
    }
}
