package com.driftmonitor.exception;

public abstract class ConfigurationException extends DriftMonitorException {
    protected ConfigurationException(String errorCode, String message) {
        super(errorCode, message);
    }
    protected ConfigurationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
