package com.driftmonitor.metric;

import com.driftmonitor.model.GroupStats;
import com.driftmonitor.model.Observation;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Group fairness statistics over protected attributes. A prediction is "positive" when its
 * predicted class equals the configured positive class.
 */
public final class FairnessMetrics {

    private FairnessMetrics() {
    }

    public static Set<String> protectedAttributes(Collection<Observation> observations) {
        Set<String> attributes = new TreeSet<>();
        observations.forEach(o -> attributes.addAll(o.protectedAttributes().keySet()));
        return attributes;
    }

    public static Map<String, GroupStats> groupStats(Collection<Observation> observations, String attribute,
                                                     String positiveClass) {
        Map<String, long[]> counters = new TreeMap<>();
        for (Observation o : observations) {
            String group = o.protectedAttributes().get(attribute);
            if (group == null || group.isBlank()) {
                continue;
            }
            // total, positives, labelledPositives, truePositives
            long[] c = counters.computeIfAbsent(group, g -> new long[4]);
            boolean predictedPositive = positiveClass.equals(o.predictedClass());
            c[0]++;
            if (predictedPositive) {
                c[1]++;
            }
            if (o.hasGroundTruth() && positiveClass.equals(o.groundTruth())) {
                c[2]++;
                if (predictedPositive) {
                    c[3]++;
                }
            }
        }
        Map<String, GroupStats> out = new LinkedHashMap<>();
        counters.forEach((group, c) -> out.put(group, GroupStats.builder()
            .count(c[0])
            .positives(c[1])
            .selectionRate(c[0] > 0 ? (double) c[1] / c[0] : 0.0)
            .labeledPositives(c[2])
            .truePositives(c[3])
            .truePositiveRate(c[2] > 0 ? (double) c[3] / c[2] : null)
            .build()));
        return out;
    }

    /**
     * Demographic parity gap: spread of selection rates across groups, or null with fewer than two groups.
     */
    public static Double demographicParityGap(Map<String, GroupStats> stats) {
        if (stats == null || stats.size() < 2) {
            return null;
        }
        double max = stats.values().stream().mapToDouble(GroupStats::getSelectionRate).max().orElse(0.0);
        double min = stats.values().stream().mapToDouble(GroupStats::getSelectionRate).min().orElse(0.0);
        return max - min;
    }

    /**
     * Equal opportunity gap: spread of true-positive rates, or null unless at least two groups have
     * labelled positives.
     */
    public static Double equalOpportunityGap(Map<String, GroupStats> stats) {
        if (stats == null) {
            return null;
        }
        List<Double> rates = stats.values().stream()
            .map(GroupStats::getTruePositiveRate)
            .filter(Objects::nonNull)
            .toList();
        if (rates.size() < 2) {
            return null;
        }
        double max = rates.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double min = rates.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        return max - min;
    }

    /**
     * Disparate impact ratio between the majority group and each other group, always taken as the
     * lower selection rate over the higher one so it never exceeds 1. The majority is the privileged
     * group when one is configured and present, otherwise the most populous group. The reported
     * minority is the disadvantaged side of the worst pair, which may be the majority itself.
     */
    public static DisparateImpact disparateImpact(Map<String, GroupStats> stats, String privilegedGroup) {
        if (stats == null || stats.size() < 2) {
            return null;
        }
        String majority = privilegedGroup != null && stats.containsKey(privilegedGroup)
            ? privilegedGroup
            : stats.entrySet().stream()
                .max(Comparator.comparingLong((Map.Entry<String, GroupStats> e) -> e.getValue().getCount())
                    .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElseThrow();
        double majorityRate = stats.get(majority).getSelectionRate();

        DisparateImpact worst = null;
        for (Map.Entry<String, GroupStats> e : stats.entrySet()) {
            if (e.getKey().equals(majority)) {
                continue;
            }
            double rate = e.getValue().getSelectionRate();
            double higher = Math.max(rate, majorityRate);
            double ratio = higher > 0 ? Math.min(rate, majorityRate) / higher : 1.0;
            if (worst == null || ratio < worst.ratio()) {
                worst = rate <= majorityRate
                    ? new DisparateImpact(ratio, e.getKey(), majority)
                    : new DisparateImpact(ratio, majority, e.getKey());
            }
        }
        return worst;
    }

    public record DisparateImpact(double ratio, String minorityGroup, String majorityGroup) {
    }
}
