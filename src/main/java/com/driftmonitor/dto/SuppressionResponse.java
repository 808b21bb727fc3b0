package com.driftmonitor.dto;

import com.driftmonitor.entity.AlertSuppression;
import com.driftmonitor.model.Severity;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuppressionResponse {
    UUID id;
    String modelId;
    String metricName;
    Set<Severity> severities;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startsAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant endsAt;
    String reason;
    String approvedBy;
    String createdBy;
    long useCount;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastUsedAt;

    public static SuppressionResponse from(AlertSuppression s) {
        return SuppressionResponse.builder()
            .id(s.getId())
            .modelId(s.getModelId())
            .metricName(s.getMetricName())
            .severities(s.getSeverities())
            .startsAt(s.getStartsAt())
            .endsAt(s.getEndsAt())
            .reason(s.getReason())
            .approvedBy(s.getApprovedBy())
            .createdBy(s.getCreatedBy())
            .useCount(s.getUseCount())
            .lastUsedAt(s.getLastUsedAt())
            .build();
    }
}
