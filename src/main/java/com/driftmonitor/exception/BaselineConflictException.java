package com.driftmonitor.exception;

public class BaselineConflictException extends ConcurrencyException {
    public BaselineConflictException(String modelId) {
        super("BASELINE_CONFLICT",
              "Another baseline was activated concurrently for model '" + modelId + "'. Retry the request.");
    }
}
