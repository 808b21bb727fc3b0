package com.driftmonitor.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AnalyzeNowRequest {

    @NotBlank(message = "modelId is required")
    String modelId;
}
