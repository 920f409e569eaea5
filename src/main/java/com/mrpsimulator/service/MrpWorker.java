package com.mrpsimulator.service;

import com.mrpsimulator.dto.ManufacturingOrderLine;
import com.mrpsimulator.dto.ScenarioRequest;
import com.mrpsimulator.dto.UrgencyStatus;
import com.mrpsimulator.model.DemandOrder;
import com.mrpsimulator.model.PlanningContext;
import com.mrpsimulator.model.RoutingStep;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

@Component
public class MrpWorker {

    public static final int URGENT_THRESHOLD_DAYS = 7; // inclusive
    public static final double ZERO_RATE_HOURS = 9_999.0;

    public WorkerResult plan(int orderIndex, DemandOrder order, PlanningContext context,
                             ScenarioRequest params, LocalDate today) {
        String article = order.getArticle();
        if (order.getDueDate().isAfter(today.plusDays(params.getHorizonDays()))) {
            return WorkerResult.outsideHorizon(orderIndex, article);
        }

        double net = order.getQuantity() - context.stockOf(article) - context.wipOf(article);
        if (net <= 0.0) {
            return WorkerResult.covered(orderIndex, article);
        }

        List<RoutingStep> routing = context.routingOf(article);
        if (routing.isEmpty()) {
            return WorkerResult.unrouted(orderIndex, article);
        }

        double qtyToBuild = quantityToBuild(net, context.lotSizeOf(article));
        long daysRemaining = ChronoUnit.DAYS.between(today, order.getDueDate());
        UrgencyStatus status = daysRemaining <= URGENT_THRESHOLD_DAYS ? UrgencyStatus.URGENT : UrgencyStatus.NORMAL;

        List<ManufacturingOrderLine> lines = new ArrayList<>(routing.size());
        Map<String, Double> load = new TreeMap<>();
        for (RoutingStep step : routing) {
            double hours = requiredHours(step, qtyToBuild) * params.getSaturationFactor();
            lines.add(ManufacturingOrderLine.builder()
                .article(article)
                .center(step.getCenter())
                .routingSequence(step.getSequence())
                .quantity(qtyToBuild)
                .requiredHours(hours)
                .dueDate(order.getDueDate())
                .status(status)
                .daysRemaining(daysRemaining)
                .orderRef(order.getOrderRef())
                .sourceIndex(orderIndex)
                .build());
            load.merge(step.getCenter(), hours, Double::sum);
        }
        return new WorkerResult(orderIndex, article, true, false, List.copyOf(lines), Collections.unmodifiableMap(load));
    }

    static double quantityToBuild(double net, OptionalDouble lotSize) {
        if (lotSize.isEmpty()) {
            return net;
        }
        double lot = lotSize.getAsDouble();
        return Math.ceil(net / lot) * lot;
    }

    static double requiredHours(RoutingStep step, double quantity) {
        if (step.getHourlyRate() == 0.0) {
            return ZERO_RATE_HOURS;
        }
        return step.getSetupTime() + (quantity / step.getHourlyRate()) * 60.0;
    }
}
