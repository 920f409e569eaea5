package com.mrpsimulator.service;

import com.mrpsimulator.dto.ManufacturingOrderLine;
import com.mrpsimulator.dto.SaturationRecord;
import com.mrpsimulator.dto.ScenarioRequest;
import com.mrpsimulator.dto.ScenarioResponse;
import com.mrpsimulator.dto.UnitFailure;
import com.mrpsimulator.dto.UrgencyStatus;
import com.mrpsimulator.model.PlanningContext;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

@Component
public class ResultAggregator {

    public static final double SATURATION_CAP_PCT = 999.9;

    static final Comparator<ManufacturingOrderLine> CANONICAL_ORDER =
        Comparator.comparingLong(ManufacturingOrderLine::getDaysRemaining)
            .thenComparing(ManufacturingOrderLine::getArticle)
            .thenComparing(ManufacturingOrderLine::getCenter)
            .thenComparingInt(ManufacturingOrderLine::getSourceIndex)
            .thenComparingInt(ManufacturingOrderLine::getRoutingSequence);

    public ScenarioResponse aggregate(List<WorkerResult> results, List<UnitFailure> failures,
                                      PlanningContext context, ScenarioRequest params,
                                      long snapshotVersion, Instant generatedAt) {
        List<ManufacturingOrderLine> lines = new ArrayList<>();
        Map<String, Double> load = new TreeMap<>();
        TreeSet<String> unrouted = new TreeSet<>();
        for (WorkerResult result : results) {
            lines.addAll(result.lines());
            result.centerLoad().forEach((center, hours) -> load.merge(center, hours, Double::sum));
            if (result.unrouted()) {
                unrouted.add(result.article());
            }
        }

        List<ManufacturingOrderLine> sequence = number(lines);
        List<SaturationRecord> saturation = saturation(load, context);
        List<SaturationRecord> bottlenecks = saturation.stream().filter(SaturationRecord::isBottleneck).toList();

        return ScenarioResponse.builder()
            .generatedAt(generatedAt)
            .snapshotVersion(snapshotVersion)
            .parameters(params)
            .sequence(sequence)
            .saturation(saturation)
            .kpis(kpis(sequence, load, context, bottlenecks))
            .bottlenecks(bottlenecks)
            .warnings(ScenarioResponse.Warnings.builder()
                .failedUnits(failures.size())
                .failures(List.copyOf(failures))
                .unroutedArticles(List.copyOf(unrouted))
                .build())
            .build();
    }

    private List<ManufacturingOrderLine> number(List<ManufacturingOrderLine> lines) {
        List<ManufacturingOrderLine> sorted = new ArrayList<>(lines);
        sorted.sort(CANONICAL_ORDER);
        List<ManufacturingOrderLine> numbered = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ManufacturingOrderLine line = sorted.get(i);
            int orderNumber = i + 1;
            numbered.add(line.toBuilder()
                .orderNumber(orderNumber)
                .manufacturingOrderId(String.format(Locale.ROOT, "MO-%05d-%s-%d", orderNumber, line.getArticle(), line.getRoutingSequence()))
                .quantity(round(line.getQuantity()))
                .requiredHours(round(line.getRequiredHours()))
                .build());
        }
        return List.copyOf(numbered);
    }

    private List<SaturationRecord> saturation(Map<String, Double> load, PlanningContext context) {
        TreeSet<String> centers = new TreeSet<>(context.centers());
        centers.addAll(load.keySet());

        List<SaturationRecord> records = new ArrayList<>(centers.size());
        for (String center : centers) {
            double required = load.getOrDefault(center, 0.0);
            double available = context.capacityOf(center);
            double pct = saturationPct(required, available);
            records.add(SaturationRecord.builder()
                .center(center)
                .requiredHours(round(required))
                .availableHours(round(available))
                .saturationPct(round(pct))
                .bottleneck(pct > 100.0)
                .build());
        }
        records.sort(Comparator.comparingDouble(SaturationRecord::getSaturationPct).reversed()
            .thenComparing(SaturationRecord::getCenter));
        return List.copyOf(records);
    }

    static double saturationPct(double required, double available) {
        if (required <= 0.0) {
            return 0.0;
        }
        if (available <= 0.0) {
            return SATURATION_CAP_PCT;
        }
        return Math.min(required / available * 100.0, SATURATION_CAP_PCT);
    }

    private ScenarioResponse.Kpis kpis(List<ManufacturingOrderLine> sequence, Map<String, Double> load,
                                       PlanningContext context, List<SaturationRecord> bottlenecks) {
        // from raw loads, so a tiny load still counts as an active center
        Map<String, Double> active = new TreeMap<>();
        load.forEach((center, hours) -> {
            if (hours > 0.0) {
                active.put(center, hours);
            }
        });
        double average = active.entrySet().stream()
            .mapToDouble(e -> saturationPct(e.getValue(), context.capacityOf(e.getKey())))
            .average().orElse(0.0);
        double totalHours = load.values().stream().mapToDouble(Double::doubleValue).sum();
        int urgent = (int) sequence.stream().filter(l -> l.getStatus() == UrgencyStatus.URGENT).count();

        return ScenarioResponse.Kpis.builder()
            .urgentArticles(urgent)
            .totalOrders(sequence.size())
            .averageSaturation(round(average))
            .bottleneckCount(bottlenecks.size())
            .totalRequiredHours(round(totalHours))
            .activeCenters(active.size())
            .build();
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
