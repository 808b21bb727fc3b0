package com.driftmonitor.threshold;

import com.driftmonitor.exception.InvalidThresholdTableException;
import com.driftmonitor.model.MetricFamily;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Value
@Builder
@Jacksonized
public class ThresholdTable {
    Map<MetricFamily, Double> weights;
    List<ThresholdRule> rules;

    public Optional<ThresholdRule> rule(String metricType) {
        return rules.stream().filter(r -> r.getMetric().equals(metricType)).findFirst();
    }

    public double weight(MetricFamily family) {
        return weights.getOrDefault(family, 0.0);
    }

    /**
     * Rejects tables the classifier cannot apply consistently.
     */
    public ThresholdTable validate() {
        if (rules == null || rules.isEmpty()) {
            throw new InvalidThresholdTableException("Threshold table has no rules");
        }
        if (weights == null || weights.isEmpty()) {
            throw new InvalidThresholdTableException("Threshold table has no family weights");
        }
        Map<String, Long> duplicates = rules.stream()
            .collect(Collectors.groupingBy(r -> String.valueOf(r.getMetric()), Collectors.counting()));
        duplicates.forEach((metric, count) -> {
            if (count > 1) {
                throw new InvalidThresholdTableException("Duplicate rule for metric '" + metric + "'");
            }
        });
        for (ThresholdRule rule : rules) {
            if (rule.getMetric() == null || rule.getMetric().isBlank()) {
                throw new InvalidThresholdTableException("Rule without metric name");
            }
            if (rule.getFamily() == null || rule.getDirection() == null) {
                throw new InvalidThresholdTableException("Rule '" + rule.getMetric() + "' needs family and direction");
            }
            boolean ordered = rule.getDirection() == ThresholdDirection.HIGHER_IS_WORSE
                ? rule.getWarning() <= rule.getCritical()
                : rule.getWarning() >= rule.getCritical();
            if (!ordered) {
                throw new InvalidThresholdTableException("Rule '" + rule.getMetric()
                    + "' has warning/critical bounds in the wrong order for " + rule.getDirection());
            }
        }
        Map<MetricFamily, Double> scored = new EnumMap<>(MetricFamily.class);
        weights.forEach((family, weight) -> {
            if (family == MetricFamily.COMPOSITE) {
                throw new InvalidThresholdTableException("COMPOSITE family cannot carry a weight");
            }
            if (weight == null || weight < 0) {
                throw new InvalidThresholdTableException("Weight for " + family + " must be non-negative");
            }
            scored.put(family, weight);
        });
        double sum = scored.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > 1e-6) {
            throw new InvalidThresholdTableException("Family weights must sum to 1.0 but sum to " + sum);
        }
        return this;
    }

    public Map<String, ThresholdRule> byMetric() {
        return rules.stream().collect(Collectors.toMap(ThresholdRule::getMetric, Function.identity()));
    }
}
