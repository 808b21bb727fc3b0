package com.driftmonitor.model;

public final class MetricNames {

    public static final String PSI = "psi";
    public static final String KL_DIVERGENCE = "kl_divergence";
    public static final String WASSERSTEIN = "wasserstein";
    public static final String DEMOGRAPHIC_PARITY_DRIFT = "demographic_parity_drift";
    public static final String EQUAL_OPPORTUNITY_DRIFT = "equal_opportunity_drift";
    public static final String DISPARATE_IMPACT_RATIO = "disparate_impact_ratio";
    public static final String PREDICTION_PSI = "prediction_psi";
    public static final String ACCURACY_DROP = "accuracy_drop";
    public static final String SHAP_DRIFT = "shap_drift";
    public static final String AGGREGATED_SCORE = "aggregated_score";

    private MetricNames() {
    }

    public static String of(String type, String subject) {
        return subject == null || subject.isBlank() ? type : type + ":" + subject;
    }

    public static String typeOf(String metricName) {
        if (metricName == null) {
            return null;
        }
        int idx = metricName.indexOf(':');
        return idx < 0 ? metricName : metricName.substring(0, idx);
    }

    public static String subjectOf(String metricName) {
        if (metricName == null) {
            return null;
        }
        int idx = metricName.indexOf(':');
        return idx < 0 ? null : metricName.substring(idx + 1);
    }
}
