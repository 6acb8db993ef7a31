package com.chicu.breachml.ml.backend;

/**
 * Оценка текущих весов на наборе примеров (без обучения).
 */
public record Evaluation(double loss, double accuracy, int samples) {
}
