package com.mrpsimulator.service;

import com.mrpsimulator.dto.ScenarioJobResponse;
import com.mrpsimulator.dto.ScenarioJobStatus;
import com.mrpsimulator.dto.ScenarioRequest;
import com.mrpsimulator.dto.ScenarioResponse;
import com.mrpsimulator.exception.JobNotFoundException;
import com.mrpsimulator.exception.ScenarioCancelledException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioJobService {

    private final ScenarioOrchestrator orchestrator;

    @Value("${mrp.jobs.pool-size:2}")
    private int poolSize;

    @Value("${mrp.jobs.max-retained:200}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public UUID submit(ScenarioRequest params, String requestId) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, params, requestId, Instant.now());
        jobs.put(jobId, state);
        cleanupIfNeeded();

        state.future = executor.submit(() -> execute(state));
        log.info("Scenario job queued | jobId={} | requestId={}", jobId, requestId);
        return jobId;
    }

    public ScenarioJobResponse getJob(UUID jobId) {
        return find(jobId).toResponse();
    }

    public ScenarioJobResponse cancel(UUID jobId) {
        JobState state = find(jobId);
        if (state.markCancelled()) {
            Future<?> future = state.future;
            if (future != null) {
                future.cancel(true);
            }
            log.info("Scenario job cancelled | jobId={}", jobId);
        }
        return state.toResponse();
    }

    private JobState find(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state;
    }

    private void execute(JobState state) {
        if (!state.markRunning()) {
            return;
        }
        try {
            ScenarioResponse result = orchestrator.calculateScenario(state.params);
            state.markCompleted(result);
        } catch (ScenarioCancelledException ex) {
            state.markCancelled();
        } catch (RuntimeException ex) {
            log.warn("Scenario job failed | jobId={} | error={}", state.jobId, ex.getMessage());
            state.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().isFinished())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final ScenarioRequest params;
        private final String requestId;
        private final Instant createdAt;
        private volatile Future<?> future;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile ScenarioJobStatus status = ScenarioJobStatus.QUEUED;
        private volatile String message = "Queued";
        private volatile ScenarioResponse result;

        private JobState(UUID jobId, ScenarioRequest params, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.params = params;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized boolean isFinished() {
            return status == ScenarioJobStatus.COMPLETED
                || status == ScenarioJobStatus.FAILED
                || status == ScenarioJobStatus.CANCELLED;
        }

        private synchronized boolean markRunning() {
            if (status != ScenarioJobStatus.QUEUED) {
                return false;
            }
            this.startedAt = Instant.now();
            this.status = ScenarioJobStatus.RUNNING;
            this.message = "Scenario running";
            return true;
        }

        private synchronized void markCompleted(ScenarioResponse result) {
            if (status != ScenarioJobStatus.RUNNING) {
                return;
            }
            this.completedAt = Instant.now();
            this.status = ScenarioJobStatus.COMPLETED;
            this.result = result;
            this.message = "Scenario completed";
        }

        private synchronized void markFailed(String message) {
            if (status != ScenarioJobStatus.RUNNING) {
                return;
            }
            this.completedAt = Instant.now();
            this.status = ScenarioJobStatus.FAILED;
            this.message = message;
        }

        private synchronized boolean markCancelled() {
            if (isFinished()) {
                return false;
            }
            this.completedAt = Instant.now();
            this.status = ScenarioJobStatus.CANCELLED;
            this.result = null;
            this.message = "Scenario cancelled";
            return true;
        }

        private synchronized ScenarioJobResponse toResponse() {
            return ScenarioJobResponse.builder()
                .jobId(jobId)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .parameters(params)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
