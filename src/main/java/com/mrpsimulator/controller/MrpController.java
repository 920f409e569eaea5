package com.mrpsimulator.controller;

import com.mrpsimulator.config.RequestIdFilter;
import com.mrpsimulator.dto.HealthResponse;
import com.mrpsimulator.dto.ScenarioJobResponse;
import com.mrpsimulator.dto.ScenarioRequest;
import com.mrpsimulator.dto.ScenarioResponse;
import com.mrpsimulator.dto.SnapshotFileRequest;
import com.mrpsimulator.dto.SnapshotLoadRequest;
import com.mrpsimulator.dto.SnapshotStatsResponse;
import com.mrpsimulator.dto.TableDataResponse;
import com.mrpsimulator.service.DataStore;
import com.mrpsimulator.service.ScenarioJobService;
import com.mrpsimulator.service.ScenarioOrchestrator;
import com.mrpsimulator.service.SnapshotFileService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MrpController {

    private final DataStore            dataStore;
    private final SnapshotFileService  snapshotFileService;
    private final ScenarioOrchestrator orchestrator;
    private final ScenarioJobService   jobService;

    @PostMapping("/mrp/snapshot")
    public ResponseEntity<SnapshotStatsResponse> loadSnapshot(
            @Valid @RequestBody SnapshotLoadRequest request, HttpServletRequest httpRequest) {
        log.info("POST /mrp/snapshot | requestId={}", RequestIdFilter.resolveRequestId(httpRequest));
        dataStore.load(request, "request");
        return ResponseEntity.status(HttpStatus.CREATED).body(dataStore.stats());
    }

    @PostMapping("/mrp/snapshot/file")
    public ResponseEntity<SnapshotStatsResponse> loadSnapshotFile(@Valid @RequestBody SnapshotFileRequest request) {
        log.info("POST /mrp/snapshot/file | path={} | forceReload={}", request.getPath(), request.isForceReload());
        return ResponseEntity.ok(snapshotFileService.load(request.getPath(), request.isForceReload()));
    }

    @GetMapping("/mrp/snapshot/stats")
    public ResponseEntity<SnapshotStatsResponse> snapshotStats() {
        return ResponseEntity.ok(dataStore.stats());
    }

    @GetMapping("/mrp/tables/{table}")
    public ResponseEntity<TableDataResponse> table(
            @PathVariable String table,
            @RequestParam(defaultValue = "1000") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(dataStore.table(table, limit));
    }

    @PostMapping("/mrp/scenarios")
    public ResponseEntity<ScenarioResponse> calculateScenario(@Valid @RequestBody ScenarioRequest request) {
        log.info("POST /mrp/scenarios | saturationFactor={} | extraShift={} | horizonDays={}",
                 request.getSaturationFactor(), request.isExtraShift(), request.getHorizonDays());
        return ResponseEntity.ok(orchestrator.calculateScenario(request));
    }

    @PostMapping("/mrp/scenarios/async")
    public ResponseEntity<ScenarioJobResponse> calculateScenarioAsync(
            @Valid @RequestBody ScenarioRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.resolveRequestId(httpRequest);
        UUID jobId = jobService.submit(request, requestId);
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/mrp/jobs/" + jobId)
            .body(jobService.getJob(jobId));
    }

    @GetMapping("/mrp/jobs/{jobId}")
    public ResponseEntity<ScenarioJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(jobService.getJob(jobId));
    }

    @DeleteMapping("/mrp/jobs/{jobId}")
    public ResponseEntity<ScenarioJobResponse> cancelJob(@PathVariable UUID jobId) {
        log.info("DELETE /mrp/jobs/{}", jobId);
        return ResponseEntity.ok(jobService.cancel(jobId));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
            .status("ok")
            .loaded(dataStore.isLoaded())
            .snapshotVersion(dataStore.current().map(l -> l.snapshot().getVersion()).orElse(null))
            .timestamp(Instant.now())
            .build());
    }
}
