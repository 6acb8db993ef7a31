package com.chicu.breachml.ml.features;

import com.chicu.breachml.risk.EntityHistory;
import com.chicu.breachml.risk.EntityHistoryProvider;
import com.chicu.breachml.risk.RiskAssessment;
import com.chicu.breachml.risk.StatisticalRiskScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.chicu.breachml.ml.features.BreachFeatures.*;

/**
 * Фичи breach-модели:
 * - под-скоры риска / 100
 * - давность последнего сертификата / 365 (cap 1)
 * - открытые действия и исторические нарушения / 10 (cap 1)
 * - возраст актива / 100 (20 лет, если неизвестен)
 * - флаги 0/1
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskFeatureExtractor implements FeatureExtractor {

    static final int UNKNOWN_DAYS_SINCE_CERT = 365;
    static final int DEFAULT_ASSET_AGE = 20;

    private final StatisticalRiskScorer scorer;
    private final EntityHistoryProvider historyProvider;
    private final Clock clock;

    @Override
    public FeatureSchema schema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Double> extract(String entityId, String organisationId, RiskAssessment assessment) {
        RiskAssessment risk = assessment != null
                ? assessment
                : scorer.computeStatisticalScore(entityId, organisationId);

        EntityHistory history = historyProvider.historyOf(entityId);
        if (history == null) history = EntityHistory.empty();

        RiskAssessment.FactorBreakdown fb = risk.factorBreakdown();

        Map<String, Double> f = new LinkedHashMap<>();
        f.put(EXPIRY_RISK, risk.expiryRiskScore() / 100.0);
        f.put(DEFECT_RISK, risk.defectRiskScore() / 100.0);
        f.put(ASSET_PROFILE_RISK, risk.assetProfileRiskScore() / 100.0);
        f.put(COVERAGE_GAP_RISK, risk.coverageGapRiskScore() / 100.0);
        f.put(EXTERNAL_FACTOR_RISK, risk.externalFactorRiskScore() / 100.0);
        f.put(DAYS_SINCE_LAST_CERT, capped(daysSince(history.lastCertificateIssuedAt()), 365));
        f.put(OPEN_ACTIONS, capped(history.openActions(), 10));
        f.put(HISTORICAL_BREACHES, capped(history.historicalBreaches(), 10));
        f.put(PROPERTY_AGE, (fb.assetAge() != null ? fb.assetAge() : DEFAULT_ASSET_AGE) / 100.0);
        f.put(HIGH_RISK_BUILDING, fb.highRiskBuilding() ? 1.0 : 0.0);
        f.put(VULNERABLE_OCCUPANTS, fb.vulnerableOccupants() ? 1.0 : 0.0);

        log.debug("🧮 features entityId={} org={} schema={}", entityId, organisationId, SCHEMA.schemaHash());
        return f;
    }

    private long daysSince(Instant issuedAt) {
        if (issuedAt == null) return UNKNOWN_DAYS_SINCE_CERT;
        long days = Duration.between(issuedAt, clock.instant()).toDays();
        return Math.max(0, days);
    }

    private static double capped(double value, double cap) {
        return Math.max(0.0, Math.min(value / cap, 1.0));
    }
}
