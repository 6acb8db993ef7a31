package com.chicu.breachml.risk;

/**
 * Ставится, когда реальный rule engine не подключён.
 * Любой вызов - ошибка конфигурации.
 */
public class UnavailableRiskScorer implements StatisticalRiskScorer {

    @Override
    public RiskAssessment computeStatisticalScore(String entityId, String organisationId) {
        throw new IllegalStateException("StatisticalRiskScorer is not configured (entityId=" + entityId + ")");
    }
}
