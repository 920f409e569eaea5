package com.mrpsimulator.exception;

public class ScenarioValidationException extends MrpSimulatorException {
    public ScenarioValidationException(String message) {
        super("SCENARIO_VALIDATION_ERROR", message);
    }
}
