package com.mrpsimulator.config;

import com.mrpsimulator.dto.SnapshotStatsResponse;
import com.mrpsimulator.exception.MrpSimulatorException;
import com.mrpsimulator.service.SnapshotFileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotBootstrap {

    private final SnapshotFileService snapshotFileService;

    @Value("${mrp.snapshot.bootstrap-path:}")
    private String bootstrapPath;

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (bootstrapPath == null || bootstrapPath.isBlank()) {
            return;
        }
        try {
            SnapshotStatsResponse stats = snapshotFileService.load(bootstrapPath, true);
            log.info("Bootstrap snapshot loaded | path={} | version={} | rows={}",
                     bootstrapPath, stats.getVersion(), stats.getRowCounts());
        } catch (MrpSimulatorException ex) {
            log.error("Bootstrap snapshot rejected | path={} | code={} | error={}",
                      bootstrapPath, ex.getErrorCode(), ex.getMessage());
        }
    }
}
