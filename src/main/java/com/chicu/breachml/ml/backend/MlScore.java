package com.chicu.breachml.ml.backend;

/**
 * Результат ML-ветки: скор 0..100, эвристическая уверенность и бэкенд, который его дал.
 */
public record MlScore(int score, int confidence, String backend) {

    static final double DEFAULT_TRAINING_ACCURACY = 50.0;

    /**
     * min(round(base + accuracy * 0.4 + min(feedback * 2, 20)), 95); без accuracy берём 50.
     */
    public static int confidence(int base, Double trainingAccuracy, long feedbackCount) {
        double acc = trainingAccuracy != null ? trainingAccuracy : DEFAULT_TRAINING_ACCURACY;
        double feedbackBonus = Math.min(feedbackCount * 2.0, 20.0);
        return (int) Math.min(Math.round(base + acc * 0.4 + feedbackBonus), 95);
    }
}
