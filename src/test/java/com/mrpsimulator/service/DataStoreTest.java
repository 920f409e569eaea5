package com.mrpsimulator.service;

import com.mrpsimulator.dto.SnapshotLoadRequest;
import com.mrpsimulator.dto.SnapshotStatsResponse;
import com.mrpsimulator.dto.TableDataResponse;
import com.mrpsimulator.exception.SchemaException;
import com.mrpsimulator.exception.SnapshotNotLoadedException;
import com.mrpsimulator.exception.UnknownTableException;
import com.mrpsimulator.model.DemandOrder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mrpsimulator.service.PlanningFixtures.CLOCK;
import static com.mrpsimulator.service.PlanningFixtures.plant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataStoreTest {

    private final DataStore dataStore = new DataStore(new ContextBuilder(), CLOCK);

    @Test
    void load_buildsContextAndVersionsSnapshots() {
        dataStore.load(plant(), "first");
        dataStore.load(plant(), "second");

        DataStore.LoadedSnapshot loaded = dataStore.require();
        assertThat(loaded.snapshot().getVersion()).isEqualTo(2);
        assertThat(loaded.snapshot().getSource()).isEqualTo("second");
        assertThat(loaded.snapshot().getLoadedAt()).isEqualTo(CLOCK.instant());
        assertThat(loaded.context().stockOf("ART-100")).isEqualTo(20.0);
    }

    @Test
    void load_missingTable_keepsPreviousSnapshot() {
        dataStore.load(plant(), "good");
        SnapshotLoadRequest broken = SnapshotLoadRequest.builder()
            .orders(List.of()).routingSteps(List.of()).stock(List.of())
            .build();

        assertThatThrownBy(() -> dataStore.load(broken, "broken"))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("wip")
            .hasMessageContaining("lotRules")
            .hasMessageContaining("centerCapacity");

        assertThat(dataStore.require().snapshot().getSource()).isEqualTo("good");
        assertThat(dataStore.require().snapshot().getVersion()).isEqualTo(1);
    }

    @Test
    void require_beforeLoad_fails() {
        assertThat(dataStore.isLoaded()).isFalse();
        assertThatThrownBy(dataStore::require).isInstanceOf(SnapshotNotLoadedException.class);
        assertThat(dataStore.stats().isLoaded()).isFalse();
    }

    @Test
    void stats_reportRowCountsPerTable() {
        dataStore.load(plant(), "plant");

        SnapshotStatsResponse stats = dataStore.stats();

        assertThat(stats.getStatus()).isEqualTo("ok");
        assertThat(stats.getRowCounts()).containsEntry("orders", 6)
            .containsEntry("routingSteps", 5)
            .containsEntry("wip", 3)
            .containsEntry("centerCapacity", 2);
        assertThat(stats.getCenterCount()).isEqualTo(3);
        assertThat(stats.getArticleCount()).isEqualTo(4);
    }

    @Test
    void table_limitsRowsAndReportsFullCount() {
        dataStore.load(plant(), "plant");

        TableDataResponse page = dataStore.table("orders", 2);

        assertThat(page.getTable()).isEqualTo("orders");
        assertThat(page.getCount()).isEqualTo(6);
        assertThat(page.getReturned()).isEqualTo(2);
        assertThat(page.getData()).hasSize(2).allMatch(DemandOrder.class::isInstance);
    }

    @Test
    void table_nameIsCaseInsensitiveAndEchoedCanonically() {
        dataStore.load(plant(), "plant");

        TableDataResponse page = dataStore.table("ROUTINGSTEPS", 1);

        assertThat(page.getTable()).isEqualTo("routingSteps");
        assertThat(page.getCount()).isEqualTo(5);
        assertThat(page.getReturned()).isEqualTo(1);
    }

    @Test
    void table_unknownName_fails() {
        dataStore.load(plant(), "plant");

        assertThatThrownBy(() -> dataStore.table("pedidos", 10)).isInstanceOf(UnknownTableException.class);
    }
}
