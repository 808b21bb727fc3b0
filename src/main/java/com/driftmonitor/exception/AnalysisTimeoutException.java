package com.driftmonitor.exception;

public class AnalysisTimeoutException extends DriftMonitorException {
    public AnalysisTimeoutException(String modelId, long timeoutSeconds) {
        super("ANALYSIS_TIMEOUT",
              "Analysis for model '" + modelId + "' exceeded " + timeoutSeconds + "s and was aborted.");
    }
}
