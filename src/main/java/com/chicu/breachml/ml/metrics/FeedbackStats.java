package com.chicu.breachml.ml.metrics;

public record FeedbackStats(long total, long correct, long incorrect, long partiallyCorrect) {

    public static FeedbackStats empty() {
        return new FeedbackStats(0, 0, 0, 0);
    }
}
