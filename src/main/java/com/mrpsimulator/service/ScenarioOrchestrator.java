package com.mrpsimulator.service;

import com.mrpsimulator.dto.ScenarioRequest;
import com.mrpsimulator.dto.ScenarioResponse;
import com.mrpsimulator.dto.UnitFailure;
import com.mrpsimulator.exception.EmptyScenarioException;
import com.mrpsimulator.exception.ScenarioCancelledException;
import com.mrpsimulator.exception.ScenarioValidationException;
import com.mrpsimulator.model.DemandOrder;
import com.mrpsimulator.model.PlanningContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioOrchestrator {

    private final DataStore        dataStore;
    private final MrpWorker        worker;
    private final ResultAggregator aggregator;
    private final Clock            clock;

    @Value("${mrp.worker.pool-size:0}")
    private int poolSize;

    @Value("${mrp.extra-shift.bonus-hours:40.0}")
    private double extraShiftBonusHours;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        int threads = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        executor = Executors.newFixedThreadPool(threads);
        log.info("Worker pool started | threads={}", threads);
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public ScenarioResponse calculateScenario(ScenarioRequest params) {
        validate(params);
        DataStore.LoadedSnapshot loaded = dataStore.require();
        List<DemandOrder> orders = loaded.snapshot().getOrders();
        PlanningContext base = loaded.context();
        PlanningContext context = params.isExtraShift() ? base.withCapacityBonus(extraShiftBonusHours) : base;
        LocalDate today = LocalDate.now(clock);
        long started = System.nanoTime();

        log.info("Scenario started | version={} | orders={} | saturationFactor={} | extraShift={} | horizonDays={}",
                 loaded.snapshot().getVersion(), orders.size(), params.getSaturationFactor(),
                 params.isExtraShift(), params.getHorizonDays());

        List<Future<WorkerResult>> futures = new ArrayList<>(orders.size());
        for (int i = 0; i < orders.size(); i++) {
            int index = i;
            DemandOrder order = orders.get(i);
            futures.add(executor.submit(() -> worker.plan(index, order, context, params, today)));
        }

        List<WorkerResult> results = new ArrayList<>(orders.size());
        List<UnitFailure> failures = new ArrayList<>();
        collect(futures, orders, results, failures);

        long considered = results.stream().filter(WorkerResult::inHorizon).count() + failures.size();
        if (considered == 0 && base.isEmpty()) {
            throw new EmptyScenarioException(params.getHorizonDays());
        }

        ScenarioResponse response = aggregator.aggregate(results, failures, context, params,
            loaded.snapshot().getVersion(), Instant.now(clock));
        log.info("Scenario finished | lines={} | bottlenecks={} | failedUnits={} | elapsedMs={}",
                 response.getSequence().size(), response.getBottlenecks().size(), failures.size(),
                 (System.nanoTime() - started) / 1_000_000);
        return response;
    }

    private void collect(List<Future<WorkerResult>> futures, List<DemandOrder> orders,
                         List<WorkerResult> results, List<UnitFailure> failures) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException ex) {
                int pending = cancelFrom(futures, i);
                Thread.currentThread().interrupt();
                log.warn("Scenario interrupted | pendingUnits={}", pending);
                throw new ScenarioCancelledException(pending);
            } catch (ExecutionException | CancellationException ex) {
                Throwable cause = ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex;
                String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                log.warn("Unit failed | orderIndex={} | article={} | error={}", i, orders.get(i).getArticle(), message);
                failures.add(UnitFailure.builder()
                    .orderIndex(i)
                    .article(orders.get(i).getArticle())
                    .message(message)
                    .build());
            }
        }
    }

    private int cancelFrom(List<Future<WorkerResult>> futures, int from) {
        int pending = 0;
        for (int j = from; j < futures.size(); j++) {
            if (futures.get(j).cancel(true)) {
                pending++;
            }
        }
        return pending;
    }

    private void validate(ScenarioRequest params) {
        if (params == null) {
            throw new ScenarioValidationException("scenario parameters are required");
        }
        double factor = params.getSaturationFactor();
        if (Double.isNaN(factor) || Double.isInfinite(factor) || factor <= 0.0) {
            throw new ScenarioValidationException("saturationFactor must be a finite number > 0");
        }
        if (params.getHorizonDays() <= 0) {
            throw new ScenarioValidationException("horizonDays must be > 0");
        }
    }
}
