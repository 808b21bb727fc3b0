package com.driftmonitor.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IngestPredictionsResponse {
    String modelId;
    int accepted;
    String requestId;
}
