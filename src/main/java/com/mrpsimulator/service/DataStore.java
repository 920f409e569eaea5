package com.mrpsimulator.service;

import com.mrpsimulator.dto.SnapshotLoadRequest;
import com.mrpsimulator.dto.SnapshotStatsResponse;
import com.mrpsimulator.dto.TableDataResponse;
import com.mrpsimulator.exception.SnapshotNotLoadedException;
import com.mrpsimulator.exception.UnknownTableException;
import com.mrpsimulator.model.DataSnapshot;
import com.mrpsimulator.model.PlanningContext;
import com.mrpsimulator.model.SnapshotTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class DataStore {

    private final ContextBuilder contextBuilder;
    private final Clock clock;

    private final AtomicReference<LoadedSnapshot> current = new AtomicReference<>();

    public synchronized PlanningContext load(SnapshotLoadRequest request, String source) {
        LoadedSnapshot previous = current.get();
        long version = previous == null ? 1 : previous.snapshot().getVersion() + 1;

        DataSnapshot snapshot = DataSnapshot.builder()
            .version(version)
            .loadedAt(Instant.now(clock))
            .source(source)
            .orders(copyOf(request.getOrders()))
            .routingSteps(copyOf(request.getRoutingSteps()))
            .stock(copyOf(request.getStock()))
            .wip(copyOf(request.getWip()))
            .lotRules(copyOf(request.getLotRules()))
            .centerCapacity(copyOf(request.getCenterCapacity()))
            .build();

        // build before swapping so a rejected load keeps the previous generation
        PlanningContext context = contextBuilder.build(snapshot);
        current.set(new LoadedSnapshot(snapshot, context));
        log.info("Snapshot loaded | version={} | source={} | orders={}",
                 version, source, snapshot.getOrders().size());
        return context;
    }

    public Optional<LoadedSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public LoadedSnapshot require() {
        LoadedSnapshot loaded = current.get();
        if (loaded == null) {
            throw new SnapshotNotLoadedException();
        }
        return loaded;
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public SnapshotStatsResponse stats() {
        LoadedSnapshot loaded = current.get();
        if (loaded == null) {
            return SnapshotStatsResponse.builder()
                .status("empty")
                .message("No snapshot loaded")
                .loaded(false)
                .build();
        }
        DataSnapshot snapshot = loaded.snapshot();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SnapshotTable table : SnapshotTable.values()) {
            counts.put(table.key(), table.rowsOf(snapshot).size());
        }
        return SnapshotStatsResponse.builder()
            .status("ok")
            .message("Snapshot loaded")
            .loaded(true)
            .version(snapshot.getVersion())
            .source(snapshot.getSource())
            .loadedAt(snapshot.getLoadedAt())
            .rowCounts(counts)
            .articleCount(loaded.context().articleCount())
            .centerCount(loaded.context().centers().size())
            .build();
    }

    public TableDataResponse table(String tableKey, int limit) {
        SnapshotTable table = SnapshotTable.fromKey(tableKey)
            .orElseThrow(() -> new UnknownTableException(tableKey, SnapshotTable.keys()));
        List<?> rows = table.rowsOf(require().snapshot());
        List<?> page = rows.subList(0, Math.min(limit, rows.size()));
        return TableDataResponse.builder()
            .table(table.key())
            .count(rows.size())
            .returned(page.size())
            .data(List.copyOf(page))
            .build();
    }

    private static <T> List<T> copyOf(List<T> rows) {
        return rows == null ? null : List.copyOf(rows);
    }

    public record LoadedSnapshot(DataSnapshot snapshot, PlanningContext context) {}
}
