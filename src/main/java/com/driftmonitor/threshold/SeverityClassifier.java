package com.driftmonitor.threshold;

import com.driftmonitor.exception.InvalidThresholdTableException;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricNames;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
@RequiredArgsConstructor
public class SeverityClassifier {

    private static final List<MetricFamily> SCORED_FAMILIES =
        List.of(MetricFamily.FAIRNESS, MetricFamily.DATA, MetricFamily.MODEL, MetricFamily.EXPLANATION);

    private final ThresholdTableRegistry registry;

    public Severity classify(String metricName, double value) {
        return rule(registry.current(), metricName).classify(value);
    }

    public MetricFamily familyOf(String metricName) {
        return rule(registry.current(), metricName).getFamily();
    }

    /**
     * Fills severity, threshold and normalized score of an available metric. Unavailable metrics are
     * returned unchanged.
     */
    public MetricResult grade(MetricResult result) {
        if (!result.isAvailable() || result.getValue() == null) {
            return result;
        }
        ThresholdRule rule = rule(registry.current(), result.getMetric());
        Severity severity = rule.classify(result.getValue());
        return result
            .withFamily(rule.getFamily())
            .withSeverity(severity)
            .withThreshold(rule.thresholdFor(severity))
            .withNormalizedScore(rule.normalize(result.getValue()));
    }

    public Severity maxSeverity(Collection<MetricResult> results) {
        return results.stream()
            .filter(MetricResult::isAvailable)
            .map(MetricResult::getSeverity)
            .filter(Objects::nonNull)
            .reduce(Severity.INFO, Severity::max);
    }

    /**
     * {@code Σ weight(family) * max(normalized score in family)} over the fairness, data, model and
     * explanation families. Families without an available metric contribute zero.
     */
    public AggregatedScore aggregate(Collection<MetricResult> results) {
        ThresholdTable table = registry.current();
        Map<MetricFamily, Double> maxima = new EnumMap<>(MetricFamily.class);
        SCORED_FAMILIES.forEach(f -> maxima.put(f, 0.0));
        for (MetricResult r : results) {
            if (!r.isAvailable() || r.getNormalizedScore() == null || !maxima.containsKey(r.getFamily())) {
                continue;
            }
            maxima.merge(r.getFamily(), r.getNormalizedScore(), Math::max);
        }
        double score = 0.0;
        for (MetricFamily family : SCORED_FAMILIES) {
            score += table.weight(family) * maxima.get(family);
        }
        ThresholdRule rule = rule(table, MetricNames.AGGREGATED_SCORE);
        return new AggregatedScore(score, rule.classify(score), rule.thresholdFor(rule.classify(score)), maxima);
    }

    private ThresholdRule rule(ThresholdTable table, String metricName) {
        String type = MetricNames.typeOf(metricName);
        return table.rule(type)
            .orElseThrow(() -> new InvalidThresholdTableException("No threshold rule for metric type '" + type + "'"));
    }

    public record AggregatedScore(double score, Severity severity, double threshold,
                                  Map<MetricFamily, Double> familyMaxima) {
    }
}
