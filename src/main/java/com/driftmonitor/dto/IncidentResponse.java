package com.driftmonitor.dto;

import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.entity.ResolutionCategory;
import com.driftmonitor.model.IncidentAction;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IncidentResponse {
    UUID id;
    String modelId;
    String metricName;
    MetricFamily metricFamily;
    Severity severity;
    IncidentStatus status;
    Map<String, MetricResult> triggeringMetrics;
    List<String> affectedGroups;
    List<IncidentAction> actions;
    UUID monitoringRecordId;
    ResolutionCategory resolutionCategory;
    String resolutionNotes;
    String resolvedBy;
    String riskApprovedBy;
    String complianceApprovedBy;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant riskExpiresAt;
    String acknowledgedBy;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant acknowledgedAt;
    int escalationCount;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastEscalatedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant closedAt;
    List<AlertResponse> alerts;

    public static IncidentResponse from(Incident i) {
        return from(i, null);
    }

    public static IncidentResponse from(Incident i, List<AlertResponse> alerts) {
        return IncidentResponse.builder()
            .id(i.getId())
            .modelId(i.getModelId())
            .metricName(i.getMetricName())
            .metricFamily(i.getMetricFamily())
            .severity(i.getSeverity())
            .status(i.getStatus())
            .triggeringMetrics(i.getTriggeringMetrics())
            .affectedGroups(i.getAffectedGroups())
            .actions(i.getActions())
            .monitoringRecordId(i.getMonitoringRecordId())
            .resolutionCategory(i.getResolutionCategory())
            .resolutionNotes(i.getResolutionNotes())
            .resolvedBy(i.getResolvedBy())
            .riskApprovedBy(i.getRiskApprovedBy())
            .complianceApprovedBy(i.getComplianceApprovedBy())
            .riskExpiresAt(i.getRiskExpiresAt())
            .acknowledgedBy(i.getAcknowledgedBy())
            .acknowledgedAt(i.getAcknowledgedAt())
            .escalationCount(i.getEscalationCount())
            .lastEscalatedAt(i.getLastEscalatedAt())
            .createdAt(i.getCreatedAt())
            .updatedAt(i.getUpdatedAt())
            .closedAt(i.getClosedAt())
            .alerts(alerts)
            .build();
    }
}
