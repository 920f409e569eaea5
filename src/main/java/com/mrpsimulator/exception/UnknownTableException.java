package com.mrpsimulator.exception;

import java.util.Collection;

public class UnknownTableException extends MrpSimulatorException {
    public UnknownTableException(String table, Collection<String> valid) {
        super("UNKNOWN_TABLE", "Unknown table '" + table + "'. Valid tables: " + String.join(", ", valid));
    }
}
