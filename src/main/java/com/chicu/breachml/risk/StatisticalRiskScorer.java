package com.chicu.breachml.risk;

/**
 * Порт к детерминированному rule engine, который считает базовый риск объекта.
 * Реализация живёт вне этого сервиса.
 */
public interface StatisticalRiskScorer {

    RiskAssessment computeStatisticalScore(String entityId, String organisationId);
}
