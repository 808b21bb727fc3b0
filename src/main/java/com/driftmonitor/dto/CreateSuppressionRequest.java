package com.driftmonitor.dto;

import com.driftmonitor.model.Severity;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
@Jacksonized
public class CreateSuppressionRequest {

    @NotBlank(message = "modelId is required")
    String modelId;

    /** metric name ({@code psi:age}) or type ({@code psi}); absent means every metric */
    String metricName;

    @NotEmpty(message = "severities must not be empty")
    Set<Severity> severities;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant start;

    @NotNull(message = "end is required")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant end;

    @NotBlank(message = "reason is required")
    String reason;

    String approvedBy;

    String createdBy;
}
