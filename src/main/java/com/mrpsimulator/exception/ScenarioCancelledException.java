package com.mrpsimulator.exception;

public class ScenarioCancelledException extends MrpSimulatorException {
    public ScenarioCancelledException(int pendingUnits) {
        super("SCENARIO_CANCELLED", "Scenario cancelled with " + pendingUnits + " unit(s) still pending.");
    }
}
