package com.chicu.breachml.common.enums;

public enum OutcomeType {
    BREACHED,
    NOT_BREACHED
}
