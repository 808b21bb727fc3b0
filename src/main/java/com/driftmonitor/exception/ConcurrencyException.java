package com.driftmonitor.exception;

public abstract class ConcurrencyException extends DriftMonitorException {
    protected ConcurrencyException(String errorCode, String message) {
        super(errorCode, message);
    }
}
