package com.mrpsimulator.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public enum SnapshotTable {
    ORDERS("orders", DataSnapshot::getOrders),
    ROUTING_STEPS("routingSteps", DataSnapshot::getRoutingSteps),
    STOCK("stock", DataSnapshot::getStock),
    WIP("wip", DataSnapshot::getWip),
    LOT_RULES("lotRules", DataSnapshot::getLotRules),
    CENTER_CAPACITY("centerCapacity", DataSnapshot::getCenterCapacity);

    private final String key;
    private final Function<DataSnapshot, List<?>> rows;

    SnapshotTable(String key, Function<DataSnapshot, List<?>> rows) {
        this.key = key;
        this.rows = rows;
    }

    public String key() {
        return key;
    }

    public List<?> rowsOf(DataSnapshot snapshot) {
        return rows.apply(snapshot);
    }

    public static Optional<SnapshotTable> fromKey(String key) {
        return Arrays.stream(values()).filter(t -> t.key.equalsIgnoreCase(key)).findFirst();
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(SnapshotTable::key).toList();
    }
}
