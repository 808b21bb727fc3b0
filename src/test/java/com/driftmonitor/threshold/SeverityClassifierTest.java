package com.driftmonitor.threshold;

import com.driftmonitor.exception.InvalidThresholdTableException;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.driftmonitor.support.Thresholds;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = Thresholds.defaultClassifier();

    @Test
    void grade_fillsSeverityThresholdAndScoreFromTheRuleForTheMetricType() {
        MetricResult graded = classifier.grade(available("psi:region", 0.88));

        assertThat(graded.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(graded.getFamily()).isEqualTo(MetricFamily.DATA);
        assertThat(graded.getThreshold()).isEqualTo(0.25);
        assertThat(graded.getNormalizedScore()).isEqualTo(1.0);
    }

    @Test
    void grade_leavesUnavailableMetricsUntouched() {
        MetricResult unavailable = MetricResult.unavailable("accuracy_drop", MetricFamily.MODEL, "no ground truth");
        assertThat(classifier.grade(unavailable)).isSameAs(unavailable);
    }

    @Test
    void unknownMetricType_isAConfigurationError() {
        assertThatThrownBy(() -> classifier.classify("entropy:age", 0.3))
            .isInstanceOf(InvalidThresholdTableException.class)
            .hasMessageContaining("entropy");
    }

    @Test
    void maxSeverity_ignoresUnavailableMetrics() {
        List<MetricResult> results = List.of(
            classifier.grade(available("psi:age", 0.12)),
            MetricResult.unavailable("accuracy_drop", MetricFamily.MODEL, "no labels"));
        assertThat(classifier.maxSeverity(results)).isEqualTo(Severity.WARNING);
        assertThat(classifier.maxSeverity(List.of())).isEqualTo(Severity.INFO);
    }

    @Test
    void aggregate_isWeightedSumOfFamilyMaxima() {
        List<MetricResult> results = List.of(
            classifier.grade(available("psi:age", 0.05)),                      // 0.25
            classifier.grade(available("wasserstein:age", 0.225)),             // 0.75
            classifier.grade(available("disparate_impact_ratio:gender", 0.85)), // 0.75
            classifier.grade(available("prediction_psi", 0.0)));               // 0.0

        SeverityClassifier.AggregatedScore aggregated = classifier.aggregate(results);

        double expected = 0.40 * 0.75 + 0.30 * 0.75 + 0.20 * 0.0 + 0.10 * 0.0;
        assertThat(aggregated.score()).isCloseTo(expected, within(1e-6));
        assertThat(aggregated.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(aggregated.familyMaxima()).containsEntry(MetricFamily.EXPLANATION, 0.0);
    }

    @Test
    void aggregate_matchesWeightedSumForRandomInputs() {
        Random random = new Random(7);
        for (int trial = 0; trial < 100; trial++) {
            double psi = random.nextDouble() * 0.4;
            double dp = random.nextDouble() * 0.2;
            double pred = random.nextDouble() * 0.4;
            double shap = random.nextDouble() * 0.3;
            List<MetricResult> results = List.of(
                classifier.grade(available("psi:x", psi)),
                classifier.grade(available("demographic_parity_drift:g", dp)),
                classifier.grade(available("prediction_psi", pred)),
                classifier.grade(available("shap_drift:x", shap)));

            double expected = 0.40 * results.get(1).getNormalizedScore()
                + 0.30 * results.get(0).getNormalizedScore()
                + 0.20 * results.get(2).getNormalizedScore()
                + 0.10 * results.get(3).getNormalizedScore();
            double score = classifier.aggregate(results).score();
            assertThat(score).isCloseTo(expected, within(1e-6)).isBetween(0.0, 1.0);
        }
    }

    private static MetricResult available(String metric, double value) {
        return MetricResult.builder().metric(metric).available(true).value(value).build();
    }
}
