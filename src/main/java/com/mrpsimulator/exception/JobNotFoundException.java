package com.mrpsimulator.exception;

import java.util.UUID;

public class JobNotFoundException extends MrpSimulatorException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Scenario job with id '" + jobId + "' not found.");
    }
}
