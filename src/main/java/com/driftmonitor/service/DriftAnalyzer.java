package com.driftmonitor.service;

import com.driftmonitor.entity.BaselineSnapshot;
import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.entity.PredictionRecord;
import com.driftmonitor.exception.InsufficientSamplesException;
import com.driftmonitor.exception.MalformedFeatureException;
import com.driftmonitor.metric.DistributionSummarizer;
import com.driftmonitor.metric.DriftMetrics;
import com.driftmonitor.metric.FairnessMetrics;
import com.driftmonitor.model.BaselineSummary;
import com.driftmonitor.model.GroupStats;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricNames;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.NumericFeatureSummary;
import com.driftmonitor.model.Observation;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.PredictionRepository;
import com.driftmonitor.threshold.SeverityClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Computes one monitoring record for a model over a time window. Nothing is persisted here; the
 * caller decides whether the record is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriftAnalyzer {

    private final PredictionRepository predictions;
    private final BaselineService baselineService;
    private final SeverityClassifier classifier;
    private final Clock clock;

    @Value("${drift.analysis.min-samples:30}")
    private int minSamples;

    @Value("${drift.analysis.positive-class:1}")
    private String positiveClass;

    @Value("#{${drift.fairness.privileged-groups:{:}}}")
    private Map<String, String> privilegedGroups = Map.of();

    public MonitoringRecord analyze(String modelId, Instant from, Instant to, String runId) {
        long started = System.nanoTime();
        BaselineSnapshot baseline = baselineService.getActiveBaseline(modelId);

        List<PredictionRecord> records = predictions.findWindow(modelId, from, to);
        if (records.size() < minSamples) {
            throw new InsufficientSamplesException(modelId, records.size(), minSamples);
        }
        List<Observation> window = records.stream().map(PredictionRecord::toObservation).toList();

        List<MetricResult> metrics = computeMetrics(baseline.getSummary(), window).stream()
            .map(classifier::grade)
            .toList();

        SeverityClassifier.AggregatedScore aggregated = classifier.aggregate(metrics);
        MetricResult aggregatedMetric = MetricResult.builder()
            .metric(MetricNames.AGGREGATED_SCORE)
            .family(MetricFamily.COMPOSITE)
            .available(true)
            .value(aggregated.score())
            .severity(aggregated.severity())
            .threshold(aggregated.threshold())
            .details(new LinkedHashMap<>(familyScores(aggregated)))
            .build();

        Map<String, MetricResult> byName = new TreeMap<>();
        metrics.forEach(m -> byName.put(m.getMetric(), m));
        byName.put(aggregatedMetric.getMetric(), aggregatedMetric);

        Severity maxSeverity = classifier.maxSeverity(byName.values());
        boolean needsRetraining = metrics.stream()
            .anyMatch(m -> m.isAvailable()
                && m.getSeverity() == Severity.CRITICAL
                && (m.getFamily() == MetricFamily.DATA || m.getFamily() == MetricFamily.MODEL));

        log.info("Analysis computed | modelId={} | runId={} | samples={} | metrics={} | aggregated={} | maxSeverity={}",
                 modelId, runId, records.size(), byName.size(), round(aggregated.score()), maxSeverity);

        return MonitoringRecord.builder()
            .modelId(modelId)
            .runId(runId)
            .baselineId(baseline.getId())
            .windowStart(from)
            .windowEnd(to)
            .sampleCount(records.size())
            .metrics(byName)
            .familyScores(familyScores(aggregated))
            .aggregatedScore(aggregated.score())
            .maxSeverity(maxSeverity)
            .needsRetraining(needsRetraining)
            .durationMs((System.nanoTime() - started) / 1_000_000)
            .createdAt(clock.instant())
            .build();
    }

    List<MetricResult> computeMetrics(BaselineSummary baseline, List<Observation> window) {
        List<MetricResult> out = new ArrayList<>();
        out.addAll(dataMetrics(baseline, window));
        out.addAll(modelMetrics(baseline, window));
        out.addAll(fairnessMetrics(baseline, window));
        out.addAll(explanationMetrics(baseline, window));
        return out;
    }

    // ── data drift ───────────────────────────────────────────────────────────

    private List<MetricResult> dataMetrics(BaselineSummary baseline, List<Observation> window) {
        List<MetricResult> out = new ArrayList<>();
        baseline.getNumericFeatures().forEach((feature, summary) -> {
            List<Object> raw = DistributionSummarizer.rawValues(window, feature);
            if (raw.isEmpty()) {
                out.add(MetricResult.unavailable(MetricNames.of(MetricNames.PSI, feature), MetricFamily.DATA,
                    "feature absent from window"));
                return;
            }
            double[] values = new double[raw.size()];
            for (int i = 0; i < raw.size(); i++) {
                Object v = raw.get(i);
                if (!DistributionSummarizer.isNumeric(v)) {
                    throw new MalformedFeatureException(feature, v);
                }
                values[i] = DistributionSummarizer.toDouble(v);
            }
            out.addAll(numericDrift(feature, summary, values));
        });
        baseline.getCategoricalFeatures().forEach((feature, reference) -> {
            List<String> raw = DistributionSummarizer.rawValues(window, feature).stream()
                .map(String::valueOf)
                .toList();
            if (raw.isEmpty()) {
                out.add(MetricResult.unavailable(MetricNames.of(MetricNames.PSI, feature), MetricFamily.DATA,
                    "feature absent from window"));
                return;
            }
            double[][] aligned = DriftMetrics.alignCategories(reference, DistributionSummarizer.frequencies(raw));
            Map<String, Object> details = Map.of("categories", aligned[0].length);
            out.add(available(MetricNames.of(MetricNames.PSI, feature), MetricFamily.DATA,
                DriftMetrics.psi(aligned[0], aligned[1]), null, details));
            out.add(available(MetricNames.of(MetricNames.KL_DIVERGENCE, feature), MetricFamily.DATA,
                DriftMetrics.klDivergence(aligned[1], aligned[0]), null, details));
        });
        return out;
    }

    private List<MetricResult> numericDrift(String feature, NumericFeatureSummary summary, double[] values) {
        double[] expected = summary.getBinProportions().stream().mapToDouble(Double::doubleValue).toArray();
        double[] actual = DriftMetrics.binProportions(values, summary.getBinEdges());
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double currentMean = Arrays.stream(sorted).average().orElse(0.0);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("bins", expected.length);
        details.put("baselineMean", round(summary.getMean()));
        details.put("currentMean", round(currentMean));

        List<MetricResult> out = new ArrayList<>();
        out.add(available(MetricNames.of(MetricNames.PSI, feature), MetricFamily.DATA,
            DriftMetrics.psi(expected, actual), null, details));
        out.add(available(MetricNames.of(MetricNames.KL_DIVERGENCE, feature), MetricFamily.DATA,
            DriftMetrics.klDivergence(actual, expected), null, details));
        out.add(available(MetricNames.of(MetricNames.WASSERSTEIN, feature), MetricFamily.DATA,
            DriftMetrics.normalizedWasserstein(summary.getPercentiles(), DriftMetrics.percentiles(sorted),
                summary.getMax() - summary.getMin()),
            null, details));
        return out;
    }

    // ── model behaviour ──────────────────────────────────────────────────────

    private List<MetricResult> modelMetrics(BaselineSummary baseline, List<Observation> window) {
        List<MetricResult> out = new ArrayList<>();
        double[][] aligned = DriftMetrics.alignCategories(
            baseline.getPredictionDistribution(), DistributionSummarizer.predictionDistribution(window));
        out.add(available(MetricNames.PREDICTION_PSI, MetricFamily.MODEL,
            DriftMetrics.psi(aligned[0], aligned[1]), null, Map.of("classes", aligned[0].length)));

        Double currentAccuracy = DistributionSummarizer.accuracy(window);
        if (baseline.getAccuracy() == null || currentAccuracy == null) {
            out.add(MetricResult.unavailable(MetricNames.ACCURACY_DROP, MetricFamily.MODEL,
                "ground truth labels absent"));
        } else {
            out.add(available(MetricNames.ACCURACY_DROP, MetricFamily.MODEL,
                baseline.getAccuracy() - currentAccuracy, baseline.getAccuracy(),
                Map.of("currentAccuracy", round(currentAccuracy))));
        }
        return out;
    }

    // ── fairness ─────────────────────────────────────────────────────────────

    private List<MetricResult> fairnessMetrics(BaselineSummary baseline, List<Observation> window) {
        List<MetricResult> out = new ArrayList<>();
        baseline.getGroupStats().forEach((attribute, baseStats) -> {
            Map<String, GroupStats> current = FairnessMetrics.groupStats(window, attribute, positiveClass);

            String dpName = MetricNames.of(MetricNames.DEMOGRAPHIC_PARITY_DRIFT, attribute);
            Double dpBase = FairnessMetrics.demographicParityGap(baseStats);
            Double dpNow = FairnessMetrics.demographicParityGap(current);
            if (dpBase == null || dpNow == null) {
                out.add(MetricResult.unavailable(dpName, MetricFamily.FAIRNESS, "fewer than two groups observed"));
            } else {
                out.add(available(dpName, MetricFamily.FAIRNESS, Math.abs(dpNow - dpBase), dpBase,
                    Map.of("currentGap", round(dpNow), "selectionRates", rates(current, GroupStats::getSelectionRate)))
                    .withAffectedGroups(extremeGroups(attribute, current, GroupStats::getSelectionRate)));
            }

            String eoName = MetricNames.of(MetricNames.EQUAL_OPPORTUNITY_DRIFT, attribute);
            Double eoBase = FairnessMetrics.equalOpportunityGap(baseStats);
            Double eoNow = FairnessMetrics.equalOpportunityGap(current);
            if (eoBase == null || eoNow == null) {
                out.add(MetricResult.unavailable(eoName, MetricFamily.FAIRNESS, "ground truth labels absent"));
            } else {
                out.add(available(eoName, MetricFamily.FAIRNESS, Math.abs(eoNow - eoBase), eoBase,
                    Map.of("currentGap", round(eoNow)))
                    .withAffectedGroups(extremeGroups(attribute, current, GroupStats::getTruePositiveRate)));
            }

            String diName = MetricNames.of(MetricNames.DISPARATE_IMPACT_RATIO, attribute);
            String privileged = privilegedGroups.get(attribute);
            FairnessMetrics.DisparateImpact diBase = FairnessMetrics.disparateImpact(baseStats, privileged);
            FairnessMetrics.DisparateImpact diNow = FairnessMetrics.disparateImpact(current, privileged);
            if (diNow == null) {
                out.add(MetricResult.unavailable(diName, MetricFamily.FAIRNESS, "fewer than two groups observed"));
            } else {
                out.add(available(diName, MetricFamily.FAIRNESS, diNow.ratio(),
                    diBase != null ? diBase.ratio() : null,
                    Map.of("minorityGroup", diNow.minorityGroup(), "majorityGroup", diNow.majorityGroup()))
                    .withAffectedGroups(List.of(attribute + "=" + diNow.minorityGroup())));
            }
        });
        return out;
    }

    // ── explanations ─────────────────────────────────────────────────────────

    private List<MetricResult> explanationMetrics(BaselineSummary baseline, List<Observation> window) {
        Map<String, Double> reference = baseline.getShapMeanAbs();
        if (reference == null || reference.isEmpty()) {
            return List.of();
        }
        Map<String, Double> current = DistributionSummarizer.shapMeanAbs(window);
        List<MetricResult> out = new ArrayList<>();
        if (current.isEmpty()) {
            reference.keySet().forEach(feature -> out.add(MetricResult.unavailable(
                MetricNames.of(MetricNames.SHAP_DRIFT, feature), MetricFamily.EXPLANATION,
                "no SHAP values logged in window")));
            return out;
        }
        double refTotal = reference.values().stream().mapToDouble(Double::doubleValue).sum();
        double curTotal = current.values().stream().mapToDouble(Double::doubleValue).sum();
        reference.forEach((feature, refMean) -> {
            double refShare = refTotal > 0 ? refMean / refTotal : 0.0;
            double curShare = curTotal > 0 ? current.getOrDefault(feature, 0.0) / curTotal : 0.0;
            out.add(available(MetricNames.of(MetricNames.SHAP_DRIFT, feature), MetricFamily.EXPLANATION,
                Math.abs(curShare - refShare), refShare, Map.of("currentShare", round(curShare))));
        });
        return out;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static MetricResult available(String name, MetricFamily family, double value, Double baselineValue,
                                          Map<String, Object> details) {
        return MetricResult.builder()
            .metric(name)
            .family(family)
            .available(true)
            .value(value)
            .baselineValue(baselineValue)
            .details(details)
            .build();
    }

    private static List<String> extremeGroups(String attribute, Map<String, GroupStats> stats,
                                              Function<GroupStats, Double> rate) {
        List<Map.Entry<String, Double>> rated = stats.entrySet().stream()
            .filter(e -> rate.apply(e.getValue()) != null)
            .map(e -> Map.entry(e.getKey(), rate.apply(e.getValue())))
            .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
            .toList();
        if (rated.isEmpty()) {
            return List.of();
        }
        String low = attribute + "=" + rated.get(0).getKey();
        String high = attribute + "=" + rated.get(rated.size() - 1).getKey();
        return Objects.equals(low, high) ? List.of(low) : List.of(low, high);
    }

    private static Map<String, Double> rates(Map<String, GroupStats> stats,
                                             Function<GroupStats, Double> rate) {
        Map<String, Double> out = new TreeMap<>();
        stats.forEach((group, s) -> out.put(group, round(rate.apply(s))));
        return out;
    }

    private static Map<String, Double> familyScores(SeverityClassifier.AggregatedScore aggregated) {
        Map<String, Double> out = new LinkedHashMap<>();
        aggregated.familyMaxima().forEach((family, value) -> out.put(family.name(), value));
        return out;
    }

    private static Double round(Double v) {
        return v == null ? null : Math.round(v * 10_000.0) / 10_000.0;
    }
}
