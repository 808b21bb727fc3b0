package com.driftmonitor.exception;

public class NoBaselineException extends ConfigurationException {
    public NoBaselineException(String modelId) {
        super("NO_BASELINE", "No active baseline snapshot for model '" + modelId + "'.");
    }
}
