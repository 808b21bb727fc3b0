package com.driftmonitor.dto;

import com.driftmonitor.entity.BaselineSnapshot;
import com.driftmonitor.entity.BaselineStatus;
import com.driftmonitor.model.BaselineSummary;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaselineResponse {
    UUID snapshotId;
    String modelId;
    int version;
    BaselineStatus status;
    long sampleCount;
    BaselineSummary summary;
    Map<String, Object> metadata;
    String createdBy;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant archivedAt;

    public static BaselineResponse from(BaselineSnapshot s) {
        return BaselineResponse.builder()
            .snapshotId(s.getId())
            .modelId(s.getModelId())
            .version(s.getVersion())
            .status(s.getStatus())
            .sampleCount(s.getSampleCount())
            .summary(s.getSummary())
            .metadata(s.getMetadata())
            .createdBy(s.getCreatedBy())
            .createdAt(s.getCreatedAt())
            .archivedAt(s.getArchivedAt())
            .build();
    }
}
