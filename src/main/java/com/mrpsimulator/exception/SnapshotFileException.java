package com.mrpsimulator.exception;

import lombok.Getter;

@Getter
public class SnapshotFileException extends MrpSimulatorException {
    private final boolean notFound;

    private SnapshotFileException(String message, boolean notFound, Throwable cause) {
        super("SNAPSHOT_FILE_ERROR", message, cause);
        this.notFound = notFound;
    }

    public static SnapshotFileException notFound(String path) {
        return new SnapshotFileException("Snapshot file '" + path + "' not found.", true, null);
    }

    public static SnapshotFileException invalid(String path, String details) {
        return new SnapshotFileException("Snapshot file '" + path + "' failed validation: " + details, false, null);
    }

    public static SnapshotFileException unreadable(String path, Throwable cause) {
        return new SnapshotFileException("Snapshot file '" + path + "' could not be read: " + cause.getMessage(), false, cause);
    }
}
