package com.driftmonitor.notification;

import com.driftmonitor.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertPayload {
    String title;
    String severityLabel;
    String modelId;
    String metricName;
    Double value;
    Double threshold;
    List<String> affectedGroups;
    String incidentRef;
    List<String> actionsLinks;

    public Severity severity() {
        return Severity.valueOf(severityLabel);
    }

    public boolean isCritical() {
        return Severity.CRITICAL.name().equals(severityLabel);
    }
}
