package com.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * One computed metric inside a monitoring record. Unavailable metrics carry no value and
 * no severity, only the reason.
 */
@Value
@With
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricResult {
    String metric;
    MetricFamily family;
    boolean available;
    Double value;
    Double baselineValue;
    Severity severity;
    Double threshold;
    Double normalizedScore;
    String reason;
    List<String> affectedGroups;
    Map<String, Object> details;

    public static MetricResult unavailable(String metric, MetricFamily family, String reason) {
        return MetricResult.builder()
            .metric(metric)
            .family(family)
            .available(false)
            .reason(reason)
            .build();
    }
}
