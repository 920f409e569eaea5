package com.mrpsimulator.service;

import com.mrpsimulator.exception.SchemaException;
import com.mrpsimulator.model.CenterCapacity;
import com.mrpsimulator.model.DataSnapshot;
import com.mrpsimulator.model.LotRule;
import com.mrpsimulator.model.PlanningContext;
import com.mrpsimulator.model.RoutingStep;
import com.mrpsimulator.model.SnapshotTable;
import com.mrpsimulator.model.StockLevel;
import com.mrpsimulator.model.WipRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// stock, WIP and capacity are summed per key; for lot rules the last row wins
@Slf4j
@Component
public class ContextBuilder {

    public PlanningContext build(DataSnapshot snapshot) {
        List<String> missing = new ArrayList<>();
        for (SnapshotTable table : SnapshotTable.values()) {
            if (table.rowsOf(snapshot) == null) {
                missing.add(table.key());
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }

        Map<String, Double> stock = new HashMap<>();
        for (StockLevel row : snapshot.getStock()) {
            stock.merge(row.getArticle(), row.getQuantity(), Double::sum);
        }

        Map<String, Double> wip = new HashMap<>();
        for (WipRecord row : snapshot.getWip()) {
            wip.merge(row.getArticle(), row.getQuantity(), Double::sum);
        }

        Map<String, Double> lotSize = new HashMap<>();
        for (LotRule row : snapshot.getLotRules()) {
            lotSize.put(row.getArticle(), row.getLotSize());
        }

        Map<String, List<RoutingStep>> routing = new HashMap<>();
        for (RoutingStep step : snapshot.getRoutingSteps()) {
            routing.computeIfAbsent(step.getArticle(), k -> new ArrayList<>()).add(step);
        }
        routing.values().forEach(steps -> steps.sort(Comparator.comparingInt(RoutingStep::getSequence)));

        Map<String, Double> capacity = new HashMap<>();
        for (CenterCapacity row : snapshot.getCenterCapacity()) {
            capacity.merge(row.getCenter(), row.getAvailableHours(), Double::sum);
        }

        log.info("Context built | version={} | stock={} | wip={} | lots={} | routes={} | centers={}",
                 snapshot.getVersion(), stock.size(), wip.size(), lotSize.size(), routing.size(), capacity.size());
        return new PlanningContext(stock, wip, lotSize, routing, capacity);
    }
}
