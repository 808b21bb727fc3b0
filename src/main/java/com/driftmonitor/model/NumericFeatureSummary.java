package com.driftmonitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class NumericFeatureSummary {
    long count;
    double mean;
    double std;
    double min;
    double max;
    List<Double> binEdges;
    List<Double> binProportions;
    List<Double> percentiles;
}
