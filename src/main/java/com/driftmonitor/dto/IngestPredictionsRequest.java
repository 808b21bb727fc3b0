package com.driftmonitor.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class IngestPredictionsRequest {

    @NotEmpty(message = "predictions must not be empty")
    List<@Valid PredictionSample> predictions;
}
