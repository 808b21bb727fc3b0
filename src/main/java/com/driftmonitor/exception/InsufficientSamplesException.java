package com.driftmonitor.exception;

public class InsufficientSamplesException extends DataException {
    public InsufficientSamplesException(String modelId, long found, int required) {
        super("INSUFFICIENT_SAMPLES",
              "Model '" + modelId + "' has " + found + " samples in the window; at least " + required + " are required.");
    }
}
