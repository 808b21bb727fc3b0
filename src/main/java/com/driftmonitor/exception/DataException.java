package com.driftmonitor.exception;

public abstract class DataException extends DriftMonitorException {
    protected DataException(String errorCode, String message) {
        super(errorCode, message);
    }
}
