package com.driftmonitor.metric;

import com.driftmonitor.model.BaselineSummary;
import com.driftmonitor.model.GroupStats;
import com.driftmonitor.model.NumericFeatureSummary;
import com.driftmonitor.model.Observation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public final class DistributionSummarizer {

    private DistributionSummarizer() {
    }

    public static BaselineSummary summarize(Collection<Observation> observations, int numericBins,
                                            String positiveClass) {
        Map<String, NumericFeatureSummary> numeric = new TreeMap<>();
        Map<String, Map<String, Double>> categorical = new TreeMap<>();

        for (String feature : featureNames(observations)) {
            List<Object> raw = rawValues(observations, feature);
            if (raw.isEmpty()) {
                continue;
            }
            if (raw.stream().allMatch(DistributionSummarizer::isNumeric)) {
                double[] values = raw.stream().mapToDouble(DistributionSummarizer::toDouble).toArray();
                numeric.put(feature, numericSummary(values, numericBins));
            } else {
                categorical.put(feature, frequencies(raw.stream().map(String::valueOf).toList()));
            }
        }

        Map<String, Map<String, GroupStats>> groups = new TreeMap<>();
        for (String attribute : FairnessMetrics.protectedAttributes(observations)) {
            groups.put(attribute, FairnessMetrics.groupStats(observations, attribute, positiveClass));
        }

        return BaselineSummary.builder()
            .sampleCount(observations.size())
            .numericFeatures(numeric)
            .categoricalFeatures(categorical)
            .predictionDistribution(predictionDistribution(observations))
            .positiveRate(positiveRate(observations, positiveClass))
            .accuracy(accuracy(observations))
            .groupStats(groups)
            .shapMeanAbs(shapMeanAbs(observations))
            .build();
    }

    public static NumericFeatureSummary numericSummary(double[] values, int bins) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double mean = Arrays.stream(sorted).average().orElse(0.0);
        double variance = Arrays.stream(sorted).map(v -> (v - mean) * (v - mean)).sum()
            / Math.max(1, sorted.length - 1);
        List<Double> edges = DriftMetrics.quantileEdges(sorted, bins);
        double[] proportions = DriftMetrics.binProportions(sorted, edges);
        return NumericFeatureSummary.builder()
            .count(sorted.length)
            .mean(mean)
            .std(Math.sqrt(variance))
            .min(sorted[0])
            .max(sorted[sorted.length - 1])
            .binEdges(edges)
            .binProportions(Arrays.stream(proportions).boxed().toList())
            .percentiles(DriftMetrics.percentiles(sorted))
            .build();
    }

    public static Map<String, Double> frequencies(Collection<String> values) {
        Map<String, Long> counts = new TreeMap<>();
        values.forEach(v -> counts.merge(v, 1L, Long::sum));
        Map<String, Double> out = new LinkedHashMap<>();
        counts.forEach((k, c) -> out.put(k, values.isEmpty() ? 0.0 : (double) c / values.size()));
        return out;
    }

    public static Map<String, Double> predictionDistribution(Collection<Observation> observations) {
        return frequencies(observations.stream()
            .map(Observation::predictedClass)
            .map(String::valueOf)
            .toList());
    }

    public static double positiveRate(Collection<Observation> observations, String positiveClass) {
        if (observations.isEmpty()) {
            return 0.0;
        }
        long positives = observations.stream().filter(o -> positiveClass.equals(o.predictedClass())).count();
        return (double) positives / observations.size();
    }

    /** Share of labelled observations predicted correctly, or null when none is labelled. */
    public static Double accuracy(Collection<Observation> observations) {
        List<Observation> labelled = observations.stream().filter(Observation::hasGroundTruth).toList();
        if (labelled.isEmpty()) {
            return null;
        }
        long correct = labelled.stream().filter(o -> o.groundTruth().equals(o.predictedClass())).count();
        return (double) correct / labelled.size();
    }

    public static Map<String, Double> shapMeanAbs(Collection<Observation> observations) {
        Map<String, double[]> sums = new TreeMap<>();
        for (Observation o : observations) {
            o.shapValues().forEach((feature, value) -> {
                if (value != null) {
                    double[] acc = sums.computeIfAbsent(feature, f -> new double[2]);
                    acc[0] += Math.abs(value);
                    acc[1]++;
                }
            });
        }
        Map<String, Double> out = new LinkedHashMap<>();
        sums.forEach((feature, acc) -> out.put(feature, acc[1] > 0 ? acc[0] / acc[1] : 0.0));
        return out;
    }

    public static Set<String> featureNames(Collection<Observation> observations) {
        Set<String> names = new TreeSet<>();
        observations.forEach(o -> names.addAll(o.features().keySet()));
        return names;
    }

    public static List<Object> rawValues(Collection<Observation> observations, String feature) {
        List<Object> out = new ArrayList<>();
        for (Observation o : observations) {
            Object v = o.features().get(feature);
            if (v != null) {
                out.add(v);
            }
        }
        return out;
    }

    public static boolean isNumeric(Object value) {
        if (value instanceof Number n) {
            return Double.isFinite(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Double.isFinite(Double.parseDouble(s.trim()));
            } catch (NumberFormatException ex) {
                return false;
            }
        }
        return false;
    }

    public static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(String.valueOf(value).trim());
    }
}
