package com.driftmonitor.dto;

import com.driftmonitor.model.Observation;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class PredictionSample {

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant predictedAt;

    String modelVersion;

    Map<String, Object> features;

    @NotBlank(message = "predictedClass is required")
    String predictedClass;

    @DecimalMin(value = "0.0", message = "confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "confidence must be between 0 and 1")
    Double confidence;

    Map<String, Double> classProbabilities;

    Map<String, String> protectedAttributes;

    String groundTruth;

    Map<String, Double> shapValues;

    public Observation toObservation() {
        return new Observation(features, predictedClass, confidence, protectedAttributes, groundTruth, shapValues);
    }
}
