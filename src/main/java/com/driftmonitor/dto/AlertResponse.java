package com.driftmonitor.dto;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.entity.AlertStatus;
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
public class AlertResponse {
    UUID id;
    UUID incidentId;
    String modelId;
    String metricName;
    Double value;
    Double threshold;
    Severity severity;
    AlertStatus status;
    List<String> channelsAttempted;
    List<String> channelsNotified;
    Map<String, String> deliveryFailures;
    Map<String, String> deliveryRefs;
    UUID deduplicatedFrom;
    int deduplicatedCount;
    String acknowledgedBy;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant acknowledgedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant deliveredAt;

    public static AlertResponse from(Alert a) {
        return AlertResponse.builder()
            .id(a.getId())
            .incidentId(a.getIncidentId())
            .modelId(a.getModelId())
            .metricName(a.getMetricName())
            .value(a.getValue())
            .threshold(a.getThreshold())
            .severity(a.getSeverity())
            .status(a.getStatus())
            .channelsAttempted(a.getChannelsAttempted())
            .channelsNotified(a.getChannelsNotified())
            .deliveryFailures(a.getDeliveryFailures())
            .deliveryRefs(a.getDeliveryRefs())
            .deduplicatedFrom(a.getDeduplicatedFrom())
            .deduplicatedCount(a.getDeduplicatedCount())
            .acknowledgedBy(a.getAcknowledgedBy())
            .acknowledgedAt(a.getAcknowledgedAt())
            .createdAt(a.getCreatedAt())
            .deliveredAt(a.getDeliveredAt())
            .build();
    }
}
