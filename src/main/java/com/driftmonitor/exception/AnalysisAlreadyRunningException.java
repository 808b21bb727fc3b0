package com.driftmonitor.exception;

public class AnalysisAlreadyRunningException extends ConcurrencyException {
    public AnalysisAlreadyRunningException(String modelId) {
        super("ALREADY_RUNNING", "An analysis is already in flight for model '" + modelId + "'.");
    }
}
