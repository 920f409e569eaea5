package com.mrpsimulator.exception;

public class EmptyScenarioException extends MrpSimulatorException {
    public EmptyScenarioException(int horizonDays) {
        super("EMPTY_SCENARIO",
              "No orders fall within a " + horizonDays + "-day horizon and the snapshot holds no planning data.");
    }
}
