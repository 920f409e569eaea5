package com.mrpsimulator.exception;

import lombok.Getter;

@Getter
public abstract class MrpSimulatorException extends RuntimeException {
    private final String errorCode;
    protected MrpSimulatorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected MrpSimulatorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
