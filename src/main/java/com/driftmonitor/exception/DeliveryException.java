package com.driftmonitor.exception;

public class DeliveryException extends DriftMonitorException {
    public DeliveryException(String channel, String message) {
        super("DELIVERY_FAILED", "Channel '" + channel + "': " + message);
    }
    public DeliveryException(String channel, String message, Throwable cause) {
        super("DELIVERY_FAILED", "Channel '" + channel + "': " + message, cause);
    }
}
