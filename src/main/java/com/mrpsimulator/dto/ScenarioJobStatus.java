package com.mrpsimulator.dto;

public enum ScenarioJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
