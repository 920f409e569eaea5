package com.mrpsimulator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mrpsimulator.dto.SnapshotStatsResponse;
import com.mrpsimulator.exception.SchemaException;
import com.mrpsimulator.exception.SnapshotFileException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.mrpsimulator.service.PlanningFixtures.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotFileServiceTest {

    private static final String SNAPSHOT = """
        {
          "orders": [{"orderRef": "PED-1", "article": "ART-100", "quantity": 100, "dueDate": "2026-01-08"}],
          "routingSteps": [{"article": "ART-100", "sequence": 10, "center": "910", "setupTime": 0.0833, "hourlyRate": 60}],
          "stock": [{"article": "ART-100", "quantity": 20}],
          "wip": [{"article": "ART-100", "quantity": 10}],
          "lotRules": [{"article": "ART-100", "lotSize": 50}],
          "centerCapacity": [{"center": "910", "availableHours": 160}]
        }
        """;

    @TempDir
    Path tempDir;

    private DataStore dataStore;
    private SnapshotFileService service;

    @BeforeEach
    void setUp() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        dataStore = new DataStore(new ContextBuilder(), CLOCK);
        service = new SnapshotFileService(dataStore, new ObjectMapper().findAndRegisterModules(), validator);
    }

    @Test
    void load_readsSnapshotFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("snapshot.json"), SNAPSHOT);

        SnapshotStatsResponse stats = service.load(file.toString(), false);

        assertThat(stats.getStatus()).isEqualTo("ok");
        assertThat(stats.getVersion()).isEqualTo(1);
        assertThat(stats.getSource()).startsWith("file:").endsWith("snapshot.json");
        assertThat(dataStore.require().context().lotSizeOf("ART-100")).hasValue(50.0);
    }

    @Test
    void load_unchangedFileIsNotReloadedUnlessForced() throws Exception {
        Path file = Files.writeString(tempDir.resolve("snapshot.json"), SNAPSHOT);
        service.load(file.toString(), false);

        SnapshotStatsResponse cached = service.load(file.toString(), false);
        SnapshotStatsResponse forced = service.load(file.toString(), true);

        assertThat(cached.getStatus()).isEqualTo("cached");
        assertThat(cached.getVersion()).isEqualTo(1);
        assertThat(forced.getStatus()).isEqualTo("ok");
        assertThat(forced.getVersion()).isEqualTo(2);
    }

    @Test
    void load_missingFile_fails() {
        assertThatThrownBy(() -> service.load(tempDir.resolve("absent.json").toString(), false))
            .isInstanceOf(SnapshotFileException.class)
            .satisfies(ex -> assertThat(((SnapshotFileException) ex).isNotFound()).isTrue());
    }

    @Test
    void load_malformedJson_fails() throws Exception {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "{ not json");

        assertThatThrownBy(() -> service.load(file.toString(), false))
            .isInstanceOf(SnapshotFileException.class)
            .satisfies(ex -> assertThat(((SnapshotFileException) ex).isNotFound()).isFalse());
        assertThat(dataStore.isLoaded()).isFalse();
    }

    @Test
    void load_negativeQuantity_failsValidation() throws Exception {
        Path file = Files.writeString(tempDir.resolve("negative.json"),
            SNAPSHOT.replace("\"quantity\": 20", "\"quantity\": -5"));

        assertThatThrownBy(() -> service.load(file.toString(), false))
            .isInstanceOf(SnapshotFileException.class)
            .hasMessageContaining("quantity must be >= 0");
    }

    @Test
    void load_nullRow_failsValidation() throws Exception {
        Path file = Files.writeString(tempDir.resolve("null-row.json"),
            SNAPSHOT.replace("\"orders\": [{", "\"orders\": [null, {"));

        assertThatThrownBy(() -> service.load(file.toString(), false))
            .isInstanceOf(SnapshotFileException.class)
            .hasMessageContaining("row must not be null");
        assertThat(dataStore.isLoaded()).isFalse();
    }

    @Test
    void load_fileWithoutRequiredTable_raisesSchemaError() throws Exception {
        Path file = Files.writeString(tempDir.resolve("partial.json"),
            "{\"orders\": [], \"routingSteps\": [], \"stock\": []}");

        assertThatThrownBy(() -> service.load(file.toString(), false))
            .isInstanceOf(SchemaException.class);
    }
}
