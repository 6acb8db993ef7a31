package com.chicu.breachml.ml.backend;

import java.util.List;

/**
 * Бэкенд инференса/обучения breach-модели.
 *
 * <p>Состояния: UNLOADED -> LOADED (после {@link #loadWeights} или {@link #initialize})
 * -> TRAINED (после успешного {@link #train}). {@link #predict} и {@link #train}
 * требуют LOADED/TRAINED.</p>
 *
 * <p>Скор на границе интерфейса в шкале 0..100, внутри сети цель = label / 100.</p>
 */
public interface ModelBackend {

    /** Прогноз считается "точным", если отличается от цели меньше чем на 15 пунктов. */
    double ACCURACY_TOLERANCE = 15.0;

    String name();

    WeightFormat weightFormat();

    BackendState state();

    /**
     * @return false, если веса не того формата / не той размерности / битые. Исключений не бросает.
     */
    boolean loadWeights(ModelWeights weights);

    /** Случайная инициализация весов (холодный старт обучения). */
    void initialize();

    double predict(double[] features);

    TrainingResult train(List<TrainingExample> examples, TrainingConfig config, TrainingMonitor monitor);

    Evaluation evaluate(List<TrainingExample> examples);

    ModelWeights exportWeights();

    static boolean isAccurate(double predictedScore, double target) {
        return Math.abs(predictedScore - target) < ACCURACY_TOLERANCE;
    }
}
