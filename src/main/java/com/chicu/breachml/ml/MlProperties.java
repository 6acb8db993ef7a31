package com.chicu.breachml.ml;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "ml")
public class MlProperties {

    private Inference inference = new Inference();
    private Training training = new Training();
    private Model model = new Model();
    private Metrics metrics = new Metrics();

    @Data
    public static class Inference {
        /**
         * Таймаут одного вызова predict у бэкенда, мс. Таймаут = отказ бэкенда.
         */
        private long timeoutMs = 2000;

        /** Сколько живёт запись прогноза как кеш оценки. */
        private int predictionTtlHours = 24;

        private int workerThreads = 4;
    }

    @Data
    public static class Training {
        private int maxFeedbackRows = 1000;

        /** Меньше - добираем bootstrap-примерами из портфеля. */
        private int minExamples = 10;

        private int bootstrapEntityLimit = 100;

        /** Как часто (в эпохах) сохранять прогресс в TrainingRun. */
        private int progressEveryEpochs = 10;

        private int workerThreads = 2;

        private Defaults defaults = new Defaults();
    }

    @Data
    public static class Defaults {
        private double learningRate = 0.01;
        private int epochs = 100;
        private int batchSize = 32;
        private double validationSplit = 0.2;
    }

    @Data
    public static class Model {
        /** Скрытые слои ручной сети. */
        private List<Integer> hiddenLayers = new ArrayList<>(List.of(16, 8));

        /** Скрытые слои тензорной сети. */
        private List<Integer> tensorHiddenLayers = new ArrayList<>(List.of(64, 32));

        /**
         * Seed инициализации; null = случайный на каждый экземпляр.
         */
        private Long seed;
    }

    @Data
    public static class Metrics {
        private int trainingReadyFeedback = 10;
    }
}
