package com.driftmonitor.exception;

public class InvalidRequestException extends DriftMonitorException {
    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
