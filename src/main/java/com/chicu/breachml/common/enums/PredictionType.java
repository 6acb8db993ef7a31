package com.chicu.breachml.common.enums;

public enum PredictionType {
    BREACH_PROBABILITY,
    DAYS_TO_BREACH,
    RISK_CATEGORY
}
