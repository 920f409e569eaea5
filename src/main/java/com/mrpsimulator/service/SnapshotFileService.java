package com.mrpsimulator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mrpsimulator.dto.SnapshotLoadRequest;
import com.mrpsimulator.dto.SnapshotStatsResponse;
import com.mrpsimulator.exception.SnapshotFileException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotFileService {

    private static final String SOURCE_PREFIX = "file:";

    private final DataStore    dataStore;
    private final ObjectMapper objectMapper;
    private final Validator    validator;

    private volatile FileTime lastLoadedModified;

    public synchronized SnapshotStatsResponse load(String location, boolean forceReload) {
        Path path = Path.of(location).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw SnapshotFileException.notFound(location);
        }

        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(path);
        } catch (IOException ex) {
            throw SnapshotFileException.unreadable(location, ex);
        }

        String source = SOURCE_PREFIX + path;
        boolean unchanged = dataStore.current()
            .map(loaded -> source.equals(loaded.snapshot().getSource()))
            .orElse(false) && modified.equals(lastLoadedModified);
        if (unchanged && !forceReload) {
            log.info("Snapshot file unchanged, keeping loaded snapshot | path={}", path);
            return dataStore.stats().toBuilder()
                .status("cached")
                .message("Snapshot already loaded, no changes detected")
                .build();
        }

        SnapshotLoadRequest request = read(path, location);
        dataStore.load(request, source);
        lastLoadedModified = modified;
        return dataStore.stats();
    }

    private SnapshotLoadRequest read(Path path, String location) {
        SnapshotLoadRequest request;
        try {
            request = objectMapper.readValue(path.toFile(), SnapshotLoadRequest.class);
        } catch (IOException ex) {
            throw SnapshotFileException.unreadable(location, ex);
        }
        Set<ConstraintViolation<SnapshotLoadRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
            throw SnapshotFileException.invalid(location, details);
        }
        return request;
    }
}
