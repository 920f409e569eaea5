package com.mrpsimulator.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public final class PlanningContext {

    private final Map<String, Double> stock;
    private final Map<String, Double> wip;
    private final Map<String, Double> lotSize;
    private final Map<String, List<RoutingStep>> routing;
    private final Map<String, Double> capacity;

    public PlanningContext(Map<String, Double> stock,
                           Map<String, Double> wip,
                           Map<String, Double> lotSize,
                           Map<String, List<RoutingStep>> routing,
                           Map<String, Double> capacity) {
        this.stock = Collections.unmodifiableMap(new TreeMap<>(stock));
        this.wip = Collections.unmodifiableMap(new TreeMap<>(wip));
        this.lotSize = Collections.unmodifiableMap(new TreeMap<>(lotSize));
        TreeMap<String, List<RoutingStep>> routes = new TreeMap<>();
        routing.forEach((article, steps) -> routes.put(article, List.copyOf(steps)));
        this.routing = Collections.unmodifiableMap(routes);
        this.capacity = Collections.unmodifiableMap(new TreeMap<>(capacity));
    }

    public double stockOf(String article) {
        return stock.getOrDefault(article, 0.0);
    }

    public double wipOf(String article) {
        return wip.getOrDefault(article, 0.0);
    }

    public OptionalDouble lotSizeOf(String article) {
        Double size = lotSize.get(article);
        return size != null && size > 0.0 ? OptionalDouble.of(size) : OptionalDouble.empty();
    }

    public List<RoutingStep> routingOf(String article) {
        return routing.getOrDefault(article, List.of());
    }

    public double capacityOf(String center) {
        return capacity.getOrDefault(center, 0.0);
    }

    public Set<String> centers() {
        Set<String> centers = new TreeSet<>(capacity.keySet());
        routing.values().forEach(steps -> steps.forEach(step -> centers.add(step.getCenter())));
        return Collections.unmodifiableSet(centers);
    }

    public int articleCount() {
        Set<String> articles = new TreeSet<>(stock.keySet());
        articles.addAll(wip.keySet());
        articles.addAll(lotSize.keySet());
        articles.addAll(routing.keySet());
        return articles.size();
    }

    public boolean isEmpty() {
        return stock.isEmpty() && wip.isEmpty() && lotSize.isEmpty()
            && routing.isEmpty() && capacity.isEmpty();
    }

    // scenario-local copy; this instance is left untouched
    public PlanningContext withCapacityBonus(double bonusHours) {
        Map<String, Double> boosted = new TreeMap<>();
        for (String center : centers()) {
            boosted.put(center, capacityOf(center) + bonusHours);
        }
        return new PlanningContext(stock, wip, lotSize, routing, boosted);
    }
}
