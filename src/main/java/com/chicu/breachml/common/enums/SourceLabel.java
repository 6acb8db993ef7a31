package com.chicu.breachml.common.enums;

public enum SourceLabel {
    STATISTICAL("Statistical"),
    ML_ENHANCED("ML-Enhanced");

    private final String label;

    SourceLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
