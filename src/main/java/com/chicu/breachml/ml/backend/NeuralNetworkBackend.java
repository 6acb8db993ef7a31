package com.chicu.breachml.ml.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ручная feed-forward сеть (fallback-бэкенд).
 *
 * <p>Слой l: матрица [in x out], один bias на слой (общий для всех нейронов слоя).
 * Скрытые слои ReLU, выход sigmoid. Обучение - SGD по одному примеру,
 * весь набор перемешивается каждую эпоху; batchSize и validationSplit не используются.</p>
 */
@Slf4j
public class NeuralNetworkBackend implements ModelBackend {

    public static final String NAME = "feed-forward";

    private static final double BIAS_STEP = 0.1;

    private final int[] layerSizes;
    private final Random random;

    private Matrix[] weights;
    private double[] biases;
    private BackendState state = BackendState.UNLOADED;

    public NeuralNetworkBackend(ModelArchitecture architecture, Random random) {
        this.layerSizes = architecture.layerSizes();
        this.random = random != null ? random : new Random();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WeightFormat weightFormat() {
        return WeightFormat.DENSE_LAYERS;
    }

    @Override
    public synchronized BackendState state() {
        return state;
    }

    @Override
    public synchronized boolean loadWeights(ModelWeights snapshot) {
        if (snapshot == null || snapshot.format() != WeightFormat.DENSE_LAYERS || snapshot.isEmpty()) {
            log.debug("feed-forward: weights rejected (format={})", snapshot != null ? snapshot.format() : null);
            return false;
        }
        int layerCount = layerSizes.length - 1;
        List<double[]> layers = snapshot.layers();
        if (layers.size() != layerCount) {
            log.warn("⚠️ feed-forward: expected {} weight layers, got {}", layerCount, layers.size());
            return false;
        }
        double[] b = snapshot.biases();
        if (b != null && b.length != layerCount) {
            log.warn("⚠️ feed-forward: expected {} biases, got {}", layerCount, b.length);
            return false;
        }

        try {
            Matrix[] loaded = new Matrix[layerCount];
            for (int l = 0; l < layerCount; l++) {
                loaded[l] = Matrix.fromFlat(layerSizes[l], layerSizes[l + 1], layers.get(l));
            }
            this.weights = loaded;
            // веса старого формата приходят без bias - стартуем с нуля
            this.biases = b != null ? b.clone() : new double[layerCount];
            this.state = BackendState.LOADED;
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ feed-forward: malformed weights: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void initialize() {
        int layerCount = layerSizes.length - 1;
        Matrix[] init = new Matrix[layerCount];
        for (int l = 0; l < layerCount; l++) {
            int in = layerSizes[l];
            int out = layerSizes[l + 1];
            double scale = Math.sqrt(2.0 / in);
            Matrix m = new Matrix(in, out);
            for (int i = 0; i < in; i++) {
                for (int j = 0; j < out; j++) {
                    m.set(i, j, (random.nextDouble() * 2 - 1) * scale);
                }
            }
            init[l] = m;
        }
        double[] b = new double[layerCount];
        for (int l = 0; l < layerCount; l++) {
            b[l] = random.nextDouble() * 0.1;
        }
        this.weights = init;
        this.biases = b;
        this.state = BackendState.LOADED;
    }

    @Override
    public synchronized double predict(double[] features) {
        requireReady();
        Pass pass = forward(features);
        return pass.output() * 100.0;
    }

    @Override
    public synchronized TrainingResult train(List<TrainingExample> examples, TrainingConfig config, TrainingMonitor monitor) {
        requireReady();
        if (examples == null || examples.isEmpty()) {
            throw new IllegalArgumentException("no training examples");
        }
        TrainingMonitor m = monitor != null ? monitor : TrainingMonitor.NONE;
        double lr = config.learningRate();
        int layerCount = weights.length;

        List<EpochStats> history = new ArrayList<>(config.epochs());
        List<TrainingExample> shuffled = new ArrayList<>(examples);

        for (int epoch = 0; epoch < config.epochs(); epoch++) {
            if (m.isCancelled()) {
                throw new TrainingCancelledException(epoch);
            }

            double totalLoss = 0;
            int correct = 0;
            Collections.shuffle(shuffled, random);

            for (TrainingExample sample : shuffled) {
                Pass pass = forward(sample.input());
                double prediction = pass.output();
                double target = sample.target() / 100.0;
                double outputError = target - prediction;

                totalLoss += outputError * outputError;
                if (ModelBackend.isAccurate(prediction * 100.0, sample.target())) {
                    correct++;
                }

                // дельты: выход через sigmoid', скрытые через ReLU'
                double[][] deltas = new double[layerCount][];
                double[] outPre = pass.preActivations()[layerCount];
                deltas[layerCount - 1] = new double[]{outputError * sigmoidDerivative(outPre[0])};

                for (int l = layerCount - 2; l >= 0; l--) {
                    Matrix next = weights[l + 1];
                    double[] pre = pass.preActivations()[l + 1];
                    double[] current = new double[next.rows()];
                    for (int i = 0; i < next.rows(); i++) {
                        double errorSum = 0;
                        for (int j = 0; j < next.cols(); j++) {
                            errorSum += deltas[l + 1][j] * next.get(i, j);
                        }
                        current[i] = errorSum * reluDerivative(pre[i]);
                    }
                    deltas[l] = current;
                }

                // weight += lr * activation_in * delta_out (ошибка = target - prediction)
                for (int l = 0; l < layerCount; l++) {
                    Matrix w = weights[l];
                    double[] act = pass.activations()[l];
                    double[] d = deltas[l];
                    for (int i = 0; i < w.rows(); i++) {
                        for (int j = 0; j < w.cols(); j++) {
                            w.add(i, j, lr * act[i] * d[j]);
                        }
                    }
                    for (int j = 0; j < w.cols(); j++) {
                        biases[l] += lr * d[j] * BIAS_STEP;
                    }
                }
            }

            EpochStats stats = EpochStats.of(
                    epoch,
                    totalLoss / examples.size(),
                    (correct * 100.0) / examples.size()
            );
            history.add(stats);
            m.onEpoch(stats, config.epochs());
        }

        state = BackendState.TRAINED;
        EpochStats last = history.get(history.size() - 1);
        return new TrainingResult(last.loss(), last.accuracy(), history, examples.size(), 0);
    }

    @Override
    public synchronized Evaluation evaluate(List<TrainingExample> examples) {
        requireReady();
        if (examples == null || examples.isEmpty()) return new Evaluation(0, 0, 0);
        double loss = 0;
        int correct = 0;
        for (TrainingExample e : examples) {
            double prediction = forward(e.input()).output();
            double err = e.target() / 100.0 - prediction;
            loss += err * err;
            if (ModelBackend.isAccurate(prediction * 100.0, e.target())) correct++;
        }
        return new Evaluation(loss / examples.size(), (correct * 100.0) / examples.size(), examples.size());
    }

    @Override
    public synchronized ModelWeights exportWeights() {
        requireReady();
        List<double[]> layers = new ArrayList<>(weights.length);
        for (Matrix w : weights) {
            layers.add(w.toFlat());
        }
        return ModelWeights.denseLayers(layers, biases.clone());
    }

    // =========================================================
    // forward
    // =========================================================

    /**
     * activations[0] = вход, activations[l+1] = выход слоя l; preActivations - то же до активации.
     */
    private record Pass(double[][] activations, double[][] preActivations) {
        double output() {
            return activations[activations.length - 1][0];
        }
    }

    private Pass forward(double[] input) {
        if (input == null || input.length != layerSizes[0]) {
            throw new IllegalArgumentException("expected " + layerSizes[0] + " features, got "
                    + (input == null ? "null" : input.length));
        }
        int layerCount = weights.length;
        double[][] activations = new double[layerCount + 1][];
        double[][] preActivations = new double[layerCount + 1][];
        activations[0] = input;
        preActivations[0] = input;

        double[] current = input;
        for (int l = 0; l < layerCount; l++) {
            Matrix w = weights[l];
            double[] pre = new double[w.cols()];
            double[] next = new double[w.cols()];
            boolean outputLayer = l == layerCount - 1;
            for (int j = 0; j < w.cols(); j++) {
                double sum = biases[l];
                for (int i = 0; i < w.rows(); i++) {
                    sum += current[i] * w.get(i, j);
                }
                pre[j] = sum;
                next[j] = outputLayer ? sigmoid(sum) : relu(sum);
            }
            preActivations[l + 1] = pre;
            activations[l + 1] = next;
            current = next;
        }
        return new Pass(activations, preActivations);
    }

    private void requireReady() {
        if (!state.isReady()) {
            throw new IllegalStateException("feed-forward backend is not loaded");
        }
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-Math.max(-500, Math.min(500, x))));
    }

    private static double sigmoidDerivative(double x) {
        double s = sigmoid(x);
        return s * (1 - s);
    }

    private static double relu(double x) {
        return Math.max(0, x);
    }

    private static double reluDerivative(double x) {
        return x > 0 ? 1 : 0;
    }
}
