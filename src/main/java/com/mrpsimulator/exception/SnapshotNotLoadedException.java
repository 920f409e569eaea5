package com.mrpsimulator.exception;

public class SnapshotNotLoadedException extends MrpSimulatorException {
    public SnapshotNotLoadedException() {
        super("SNAPSHOT_NOT_LOADED", "No planning snapshot loaded. Load one via /api/v1/mrp/snapshot first.");
    }
}
