package com.driftmonitor.threshold;

import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One row of the threshold table.
 *
 * <p>For {@link ThresholdDirection#HIGHER_IS_WORSE}: {@code value >= warning} is WARNING and
 * {@code value > critical} (or {@code >=} when {@code criticalInclusive}) is CRITICAL.
 * For {@link ThresholdDirection#LOWER_IS_WORSE}: {@code value < warning} is WARNING and
 * {@code value < critical} (or {@code <=} when {@code criticalInclusive}) is CRITICAL.
 */
@Value
@Builder
@Jacksonized
public class ThresholdRule {
    String metric;
    MetricFamily family;
    ThresholdDirection direction;
    double warning;
    double critical;
    boolean criticalInclusive;

    public Severity classify(double value) {
        if (direction == ThresholdDirection.LOWER_IS_WORSE) {
            if (value < critical || (criticalInclusive && value == critical)) {
                return Severity.CRITICAL;
            }
            return value < warning ? Severity.WARNING : Severity.INFO;
        }
        if (value > critical || (criticalInclusive && value == critical)) {
            return Severity.CRITICAL;
        }
        return value >= warning ? Severity.WARNING : Severity.INFO;
    }

    /**
     * Threshold the value is compared against for its severity: the critical bound when critical,
     * otherwise the warning bound.
     */
    public double thresholdFor(Severity severity) {
        return severity == Severity.CRITICAL ? critical : warning;
    }

    /**
     * Maps a value onto [0,1] piecewise-linearly: the INFO band onto [0, 0.5), the WARNING band
     * onto [0.5, 1) and CRITICAL onto 1.
     */
    public double normalize(double value) {
        Severity severity = classify(value);
        if (severity == Severity.CRITICAL) {
            return 1.0;
        }
        // distance travelled from the "perfect" end of the scale
        boolean lowerIsWorse = direction == ThresholdDirection.LOWER_IS_WORSE;
        double origin = lowerIsWorse ? 1.0 : 0.0;
        double position = Math.max(0.0, lowerIsWorse ? origin - value : value - origin);
        double warnAt = Math.abs(warning - origin);
        double critAt = Math.abs(critical - origin);
        if (severity == Severity.INFO) {
            return warnAt > 0 ? clamp(0.5 * position / warnAt, 0.0, 0.5) : 0.0;
        }
        double span = critAt - warnAt;
        return span > 0 ? clamp(0.5 + 0.5 * (position - warnAt) / span, 0.5, 1.0) : 0.5;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
