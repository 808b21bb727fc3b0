package com.driftmonitor.threshold;

import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ThresholdRuleTest {

    private final ThresholdRule psi = ThresholdRule.builder()
        .metric("psi").family(MetricFamily.DATA).direction(ThresholdDirection.HIGHER_IS_WORSE)
        .warning(0.10).critical(0.25).criticalInclusive(true)
        .build();

    private final ThresholdRule disparateImpact = ThresholdRule.builder()
        .metric("disparate_impact_ratio").family(MetricFamily.FAIRNESS)
        .direction(ThresholdDirection.LOWER_IS_WORSE)
        .warning(0.90).critical(0.80).criticalInclusive(false)
        .build();

    @Test
    void higherIsWorse_boundaries() {
        assertThat(psi.classify(0.0999)).isEqualTo(Severity.INFO);
        assertThat(psi.classify(0.10)).isEqualTo(Severity.WARNING);
        assertThat(psi.classify(0.2499)).isEqualTo(Severity.WARNING);
        assertThat(psi.classify(0.25)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void lowerIsWorse_boundaries() {
        assertThat(disparateImpact.classify(0.95)).isEqualTo(Severity.INFO);
        assertThat(disparateImpact.classify(0.90)).isEqualTo(Severity.INFO);
        assertThat(disparateImpact.classify(0.85)).isEqualTo(Severity.WARNING);
        assertThat(disparateImpact.classify(0.80)).isEqualTo(Severity.WARNING);
        assertThat(disparateImpact.classify(0.79)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void severityIsMonotonicInTheWorseningDirection() {
        Severity previous = Severity.INFO;
        for (int i = 0; i <= 1000; i++) {
            Severity s = psi.classify(i / 1000.0);
            assertThat(s.isAtLeast(previous)).as("psi=%s", i / 1000.0).isTrue();
            previous = s;
        }
        previous = Severity.INFO;
        for (int i = 1000; i >= 0; i--) {
            Severity s = disparateImpact.classify(i / 1000.0);
            assertThat(s.isAtLeast(previous)).as("di=%s", i / 1000.0).isTrue();
            previous = s;
        }
    }

    @Test
    void normalize_mapsBandsOntoUnitInterval() {
        assertThat(psi.normalize(0.0)).isEqualTo(0.0);
        assertThat(psi.normalize(0.05)).isCloseTo(0.25, within(1e-9));
        assertThat(psi.normalize(0.10)).isCloseTo(0.5, within(1e-9));
        assertThat(psi.normalize(0.175)).isCloseTo(0.75, within(1e-9));
        assertThat(psi.normalize(0.9)).isEqualTo(1.0);

        assertThat(disparateImpact.normalize(1.0)).isEqualTo(0.0);
        assertThat(disparateImpact.normalize(0.85)).isCloseTo(0.75, within(1e-9));
        assertThat(disparateImpact.normalize(0.5)).isEqualTo(1.0);
    }

    @Test
    void thresholdFor_reportsTheBoundThatWasCrossed() {
        assertThat(psi.thresholdFor(Severity.CRITICAL)).isEqualTo(0.25);
        assertThat(psi.thresholdFor(Severity.WARNING)).isEqualTo(0.10);
    }
}
