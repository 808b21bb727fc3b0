package com.driftmonitor.dto;

import com.driftmonitor.threshold.ThresholdTable;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ThresholdTableResponse {
    String source;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant loadedAt;
    ThresholdTable table;
}
