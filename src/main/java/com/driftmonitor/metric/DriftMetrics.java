package com.driftmonitor.metric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distribution-shift statistics. All methods are pure and side-effect free.
 */
public final class DriftMetrics {

    /** Floor applied to empty bins before taking logarithms. */
    public static final double EPSILON = 1e-4;

    public static final int PERCENTILE_POINTS = 101;

    private DriftMetrics() {
    }

    /**
     * Population stability index: {@code Σ (actual - expected) * ln(actual / expected)}.
     * Both inputs are bin proportions over the same bins.
     */
    public static double psi(double[] expected, double[] actual) {
        requireSameLength(expected, actual);
        double[] e = floorAndNormalize(expected);
        double[] a = floorAndNormalize(actual);
        double sum = 0.0;
        for (int i = 0; i < e.length; i++) {
            sum += (a[i] - e[i]) * Math.log(a[i] / e[i]);
        }
        return Math.max(0.0, sum);
    }

    /**
     * Kullback-Leibler divergence {@code D(p || q) = Σ p * ln(p / q)}, where {@code p} is the
     * current distribution and {@code q} the reference.
     */
    public static double klDivergence(double[] p, double[] q) {
        requireSameLength(p, q);
        double[] pn = floorAndNormalize(p);
        double[] qn = floorAndNormalize(q);
        double sum = 0.0;
        for (int i = 0; i < pn.length; i++) {
            sum += pn[i] * Math.log(pn[i] / qn[i]);
        }
        return Math.max(0.0, sum);
    }

    /**
     * First Wasserstein distance between two distributions given by their percentile grids
     * (same number of points), divided by the reference feature range.
     */
    public static double normalizedWasserstein(List<Double> referencePercentiles, List<Double> currentPercentiles,
                                               double range) {
        if (referencePercentiles.size() != currentPercentiles.size() || referencePercentiles.isEmpty()) {
            throw new IllegalArgumentException("Percentile grids must be non-empty and of equal size");
        }
        double total = 0.0;
        for (int i = 0; i < referencePercentiles.size(); i++) {
            total += Math.abs(referencePercentiles.get(i) - currentPercentiles.get(i));
        }
        double distance = total / referencePercentiles.size();
        if (range <= 0.0) {
            return distance == 0.0 ? 0.0 : 1.0;
        }
        return distance / range;
    }

    /**
     * Percentiles 0..100 (linear interpolation) of an ascending-sorted sample.
     */
    public static List<Double> percentiles(double[] sorted) {
        List<Double> out = new ArrayList<>(PERCENTILE_POINTS);
        for (int p = 0; p < PERCENTILE_POINTS; p++) {
            out.add(quantile(sorted, p / 100.0));
        }
        return out;
    }

    /**
     * Interior cut points splitting an ascending-sorted sample into {@code bins} quantile bins.
     * Duplicate edges (heavily repeated values) are collapsed.
     */
    public static List<Double> quantileEdges(double[] sorted, int bins) {
        Set<Double> edges = new LinkedHashSet<>();
        for (int i = 1; i < bins; i++) {
            edges.add(quantile(sorted, (double) i / bins));
        }
        return new ArrayList<>(edges);
    }

    /**
     * Proportion of values falling into each bin. Bin {@code i} covers {@code (edge[i-1], edge[i]]}; the
     * first bin is open below and the last open above.
     */
    public static double[] binProportions(double[] values, List<Double> edges) {
        double[] counts = new double[edges.size() + 1];
        for (double v : values) {
            counts[binIndex(v, edges)]++;
        }
        if (values.length == 0) {
            return counts;
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] /= values.length;
        }
        return counts;
    }

    /**
     * Aligns two categorical frequency tables over the union of their categories, in
     * reference-first order. Returns {@code [reference, current]}.
     */
    public static double[][] alignCategories(Map<String, Double> reference, Map<String, Double> current) {
        Set<String> categories = new LinkedHashSet<>(reference.keySet());
        categories.addAll(current.keySet());
        double[] ref = new double[categories.size()];
        double[] cur = new double[categories.size()];
        int i = 0;
        for (String category : categories) {
            ref[i] = reference.getOrDefault(category, 0.0);
            cur[i] = current.getOrDefault(category, 0.0);
            i++;
        }
        return new double[][] {ref, cur};
    }

    static double[] floorAndNormalize(double[] p) {
        double[] out = new double[p.length];
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            out[i] = Math.max(p[i], EPSILON);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }

    static double quantile(double[] sorted, double q) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot take a quantile of an empty sample");
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static int binIndex(double v, List<Double> edges) {
        for (int i = 0; i < edges.size(); i++) {
            if (v <= edges.get(i)) {
                return i;
            }
        }
        return edges.size();
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length || a.length == 0) {
            throw new IllegalArgumentException(
                "Distributions must be non-empty and share bins: " + Arrays.toString(a) + " vs " + Arrays.toString(b));
        }
    }
}
