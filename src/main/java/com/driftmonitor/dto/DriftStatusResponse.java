package com.driftmonitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftStatusResponse {
    String modelId;
    /** max severity of the latest record, or {@code UNKNOWN} before the first run */
    String status;
    long openCriticalIncidents;
    long openWarningIncidents;
    boolean needsRetraining;
    Double baselineAgeDays;
    Integer baselineVersion;
    MonitoringRecordResponse latest;
}
