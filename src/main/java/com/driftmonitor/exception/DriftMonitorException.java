package com.driftmonitor.exception;

import lombok.Getter;

@Getter
public abstract class DriftMonitorException extends RuntimeException {
    private final String errorCode;
    protected DriftMonitorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DriftMonitorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
