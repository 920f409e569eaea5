package com.mrpsimulator.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class SchemaException extends MrpSimulatorException {
    private final List<String> missingTables;

    public SchemaException(List<String> missingTables) {
        super("SCHEMA_ERROR", "Snapshot is missing required tables: " + String.join(", ", missingTables));
        this.missingTables = List.copyOf(missingTables);
    }
}
