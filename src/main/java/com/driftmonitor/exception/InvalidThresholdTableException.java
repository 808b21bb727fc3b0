package com.driftmonitor.exception;

public class InvalidThresholdTableException extends ConfigurationException {
    public InvalidThresholdTableException(String message) {
        super("INVALID_THRESHOLD_TABLE", message);
    }
    public InvalidThresholdTableException(String message, Throwable cause) {
        super("INVALID_THRESHOLD_TABLE", message, cause);
    }
}
