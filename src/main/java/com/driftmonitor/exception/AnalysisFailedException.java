package com.driftmonitor.exception;

public class AnalysisFailedException extends DriftMonitorException {
    public AnalysisFailedException(String modelId, Throwable cause) {
        super("ANALYSIS_FAILED", "Analysis for model '" + modelId + "' failed: " + cause.getMessage(), cause);
    }
}
