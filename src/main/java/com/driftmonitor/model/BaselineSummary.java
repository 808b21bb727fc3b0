package com.driftmonitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class BaselineSummary {
    long sampleCount;
    Map<String, NumericFeatureSummary> numericFeatures;
    Map<String, Map<String, Double>> categoricalFeatures;
    Map<String, Double> predictionDistribution;
    double positiveRate;
    Double accuracy;
    /** attribute -> group -> rates */
    Map<String, Map<String, GroupStats>> groupStats;
    /** feature -> mean |SHAP| */
    Map<String, Double> shapMeanAbs;
}
