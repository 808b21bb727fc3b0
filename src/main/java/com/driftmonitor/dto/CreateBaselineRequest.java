package com.driftmonitor.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class CreateBaselineRequest {

    @NotBlank(message = "modelId is required")
    String modelId;

    @NotEmpty(message = "samples must not be empty")
    List<@Valid PredictionSample> samples;

    Map<String, Object> metadata;

    String createdBy;
}
