package com.chicu.breachml.ml.features;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Набор фич breach-модели и статические веса-приоры.
 */
public final class BreachFeatures {

    public static final String EXPIRY_RISK = "expiryRiskScore";
    public static final String DEFECT_RISK = "defectRiskScore";
    public static final String ASSET_PROFILE_RISK = "assetProfileRiskScore";
    public static final String COVERAGE_GAP_RISK = "coverageGapRiskScore";
    public static final String EXTERNAL_FACTOR_RISK = "externalFactorRiskScore";
    public static final String DAYS_SINCE_LAST_CERT = "daysSinceLastCert";
    public static final String OPEN_ACTIONS = "openActionsCount";
    public static final String HISTORICAL_BREACHES = "historicalBreachCount";
    public static final String PROPERTY_AGE = "propertyAge";
    public static final String HIGH_RISK_BUILDING = "isHRB";
    public static final String VULNERABLE_OCCUPANTS = "hasVulnerableOccupants";

    public static final List<String> NAMES = List.of(
            EXPIRY_RISK,
            DEFECT_RISK,
            ASSET_PROFILE_RISK,
            COVERAGE_GAP_RISK,
            EXTERNAL_FACTOR_RISK,
            DAYS_SINCE_LAST_CERT,
            OPEN_ACTIONS,
            HISTORICAL_BREACHES,
            PROPERTY_AGE,
            HIGH_RISK_BUILDING,
            VULNERABLE_OCCUPANTS
    );

    public static final FeatureSchema SCHEMA = new FeatureSchema(NAMES);

    private BreachFeatures() {
    }

    public static Map<String, Double> defaultFeatureWeights() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put(EXPIRY_RISK, 0.25);
        w.put(DEFECT_RISK, 0.20);
        w.put(ASSET_PROFILE_RISK, 0.15);
        w.put(COVERAGE_GAP_RISK, 0.15);
        w.put(EXTERNAL_FACTOR_RISK, 0.10);
        w.put(DAYS_SINCE_LAST_CERT, 0.05);
        w.put(OPEN_ACTIONS, 0.05);
        w.put(HISTORICAL_BREACHES, 0.05);
        return w;
    }
}
