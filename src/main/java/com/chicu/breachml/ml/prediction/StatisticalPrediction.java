package com.chicu.breachml.ml.prediction;

import com.chicu.breachml.risk.RiskAssessment;

/**
 * Статистическая база прогноза: скор скорера и эвристическая уверенность.
 */
public record StatisticalPrediction(RiskAssessment assessment, int score, int confidence) {

    static final int CONF_CERTIFICATES = 95;
    static final int CONF_DEFECTS = 90;
    static final int CONF_COVERAGE_ONLY = 80;
    static final int CONF_BASELINE = 85;

    public static StatisticalPrediction of(RiskAssessment assessment) {
        int score = Math.max(0, Math.min(100, assessment.overallScore()));
        return new StatisticalPrediction(assessment, score, confidenceOf(assessment.factorBreakdown()));
    }

    /**
     * Истекающие/просроченные сертификаты -> 95, открытые дефекты -> 90,
     * только пробелы покрытия -> 80, иначе 85.
     */
    static int confidenceOf(RiskAssessment.FactorBreakdown fb) {
        if (fb.expiringCertificates() > 0 || fb.overdueCertificates() > 0) return CONF_CERTIFICATES;
        if (fb.openDefects() > 0) return CONF_DEFECTS;
        if (!fb.missingStreams().isEmpty()) return CONF_COVERAGE_ONLY;
        return CONF_BASELINE;
    }
}
