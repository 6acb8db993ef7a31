package com.chicu.breachml.common.enums;

public enum FeedbackType {
    CORRECT,
    INCORRECT,
    PARTIALLY_CORRECT
}
