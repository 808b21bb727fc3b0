package com.driftmonitor.exception;

public class MalformedFeatureException extends DataException {
    public MalformedFeatureException(String feature, Object value) {
        super("MALFORMED_FEATURE",
              "Feature '" + feature + "' is numeric in the baseline but received non-numeric value '" + value + "'.");
    }
}
