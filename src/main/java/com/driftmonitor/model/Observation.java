package com.driftmonitor.model;

import java.util.Map;

public record Observation(
    Map<String, Object> features,
    String predictedClass,
    Double confidence,
    Map<String, String> protectedAttributes,
    String groundTruth,
    Map<String, Double> shapValues
) {
    public Observation {
        features = features != null ? features : Map.of();
        protectedAttributes = protectedAttributes != null ? protectedAttributes : Map.of();
        shapValues = shapValues != null ? shapValues : Map.of();
    }

    public boolean hasGroundTruth() {
        return groundTruth != null && !groundTruth.isBlank();
    }
}
