package com.chicu.breachml.common.enums;

/**
 * Категория риска по итоговому (blended) скору.
 * Нижняя граница каждого диапазона включительна.
 */
public enum RiskCategory {
    CRITICAL(85),
    HIGH(70),
    MEDIUM(40),
    LOW(0);

    private final int lowerBound;

    RiskCategory(int lowerBound) {
        this.lowerBound = lowerBound;
    }

    public int lowerBound() {
        return lowerBound;
    }

    public static RiskCategory fromScore(int score) {
        for (RiskCategory c : values()) {
            if (score >= c.lowerBound) return c;
        }
        return LOW;
    }

    /** HIGH и CRITICAL считаем "предсказанным нарушением". */
    public boolean predictsBreach() {
        return this == CRITICAL || this == HIGH;
    }
}
