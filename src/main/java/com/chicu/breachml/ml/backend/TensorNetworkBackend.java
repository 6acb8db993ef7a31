package com.chicu.breachml.ml.backend;

import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.dataset.SplitTestAndTrain;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Основной бэкенд на DL4J/ND4J.
 *
 * <p>Dense ReLU слои (heNormal, dropout 0.2 / 0.1 только на обучении) + sigmoid выход,
 * loss = binary cross-entropy, оптимизатор Adam. Обучение батчами с валидационным хвостом.</p>
 *
 * <p>Веса сериализуются списком тензоров {data, shape} в порядке paramTable: 0_W, 0_b, 1_W, ...</p>
 */
@Slf4j
public class TensorNetworkBackend implements ModelBackend {

    public static final String NAME = "dl4j";

    /** retain probability в терминах DL4J (1 - rate) */
    private static final double[] DROPOUT_RETAIN = {0.8, 0.9};
    private static final double DEFAULT_LEARNING_RATE = 0.001;

    private final ModelArchitecture architecture;
    private final long seed;

    private MultiLayerNetwork network;
    private BackendState state = BackendState.UNLOADED;

    public TensorNetworkBackend(ModelArchitecture architecture, long seed) {
        this.architecture = architecture;
        this.seed = seed;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WeightFormat weightFormat() {
        return WeightFormat.TENSOR_LIST;
    }

    @Override
    public synchronized BackendState state() {
        return state;
    }

    @Override
    public synchronized boolean loadWeights(ModelWeights snapshot) {
        if (snapshot == null || snapshot.format() != WeightFormat.TENSOR_LIST || snapshot.isEmpty()) {
            log.debug("dl4j: weights rejected (format={})", snapshot != null ? snapshot.format() : null);
            return false;
        }
        try {
            MultiLayerNetwork net = build(DEFAULT_LEARNING_RATE);
            Map<String, INDArray> table = net.paramTable();
            List<TensorRecord> tensors = snapshot.tensors();
            if (tensors.size() != table.size()) {
                log.warn("⚠️ dl4j: expected {} tensors, got {}", table.size(), tensors.size());
                return false;
            }

            int i = 0;
            for (Map.Entry<String, INDArray> e : table.entrySet()) {
                TensorRecord t = tensors.get(i++);
                long[] expected = e.getValue().shape();
                if (!Arrays.equals(expected, t.shape())) {
                    log.warn("⚠️ dl4j: param {} shape {} != {}", e.getKey(), Arrays.toString(t.shape()), Arrays.toString(expected));
                    return false;
                }
                INDArray value = Nd4j.create(t.data(), t.shape(), 'c').castTo(e.getValue().dataType());
                net.setParam(e.getKey(), value);
            }

            this.network = net;
            this.state = BackendState.LOADED;
            return true;
        } catch (RuntimeException e) {
            log.warn("⚠️ dl4j: failed to load weights: {}", e.toString());
            return false;
        }
    }

    @Override
    public synchronized void initialize() {
        this.network = build(DEFAULT_LEARNING_RATE);
        this.state = BackendState.LOADED;
    }

    @Override
    public synchronized double predict(double[] features) {
        requireReady();
        INDArray out = network.output(toRow(features), false);
        return clampScore(out.getDouble(0) * 100.0);
    }

    @Override
    public synchronized TrainingResult train(List<TrainingExample> examples, TrainingConfig config, TrainingMonitor monitor) {
        requireReady();
        if (examples == null || examples.isEmpty()) {
            throw new IllegalArgumentException("no training examples");
        }
        TrainingMonitor m = monitor != null ? monitor : TrainingMonitor.NONE;

        // пересобираем сеть под learning rate прогона, параметры сохраняем
        MultiLayerNetwork net = build(config.learningRate());
        net.setParams(network.params().dup());

        DataSet all = toDataSet(examples);
        all.shuffle(seed);

        DataSet train = all;
        DataSet validation = null;
        int validationCount = (int) Math.floor(examples.size() * config.validationSplit());
        if (validationCount > 0 && validationCount < examples.size()) {
            SplitTestAndTrain split = all.splitTestAndTrain(examples.size() - validationCount);
            train = split.getTrain();
            validation = split.getTest();
        }

        List<EpochStats> history = new ArrayList<>(config.epochs());
        for (int epoch = 0; epoch < config.epochs(); epoch++) {
            if (m.isCancelled()) {
                throw new TrainingCancelledException(epoch);
            }

            train.shuffle(seed + epoch);
            for (DataSet batch : train.batchBy(config.batchSize())) {
                net.fit(batch);
            }

            Evaluation trainEval = evaluate(net, train);
            Evaluation validEval = validation != null ? evaluate(net, validation) : null;

            EpochStats stats = new EpochStats(
                    epoch,
                    trainEval.loss(),
                    trainEval.accuracy(),
                    validEval != null ? validEval.loss() : null,
                    validEval != null ? validEval.accuracy() : null
            );
            history.add(stats);
            m.onEpoch(stats, config.epochs());
        }

        this.network = net;
        this.state = BackendState.TRAINED;

        EpochStats last = history.get(history.size() - 1);
        log.debug("dl4j: trained samples={} validation={} loss={} acc={}",
                train.numExamples(), validation != null ? validation.numExamples() : 0, last.loss(), last.accuracy());

        return new TrainingResult(
                last.loss(),
                last.accuracy(),
                history,
                train.numExamples(),
                validation != null ? validation.numExamples() : 0
        );
    }

    @Override
    public synchronized Evaluation evaluate(List<TrainingExample> examples) {
        requireReady();
        if (examples == null || examples.isEmpty()) return new Evaluation(0, 0, 0);
        return evaluate(network, toDataSet(examples));
    }

    @Override
    public synchronized ModelWeights exportWeights() {
        requireReady();
        List<TensorRecord> tensors = new ArrayList<>();
        for (INDArray p : network.paramTable().values()) {
            INDArray copy = p.castTo(DataType.DOUBLE).dup('c');
            tensors.add(new TensorRecord(copy.data().asDouble(), copy.shape()));
        }
        return ModelWeights.tensors(tensors);
    }

    // =========================================================
    // helpers
    // =========================================================

    private MultiLayerNetwork build(double learningRate) {
        NeuralNetConfiguration.ListBuilder list = new NeuralNetConfiguration.Builder()
                .seed(seed)
                .updater(new Adam(learningRate))
                .weightInit(WeightInit.RELU)
                .list();

        int nIn = architecture.inputSize();
        List<Integer> hidden = architecture.hiddenLayers();
        for (int i = 0; i < hidden.size(); i++) {
            DenseLayer.Builder layer = new DenseLayer.Builder()
                    .nIn(nIn)
                    .nOut(hidden.get(i))
                    .activation(Activation.RELU);
            if (i < DROPOUT_RETAIN.length) {
                layer.dropOut(DROPOUT_RETAIN[i]);
            }
            list.layer(layer.build());
            nIn = hidden.get(i);
        }

        list.layer(new OutputLayer.Builder(LossFunctions.LossFunction.XENT)
                .nIn(nIn)
                .nOut(ModelArchitecture.OUTPUT_SIZE)
                .activation(Activation.SIGMOID)
                .weightInit(WeightInit.XAVIER)
                .build());

        MultiLayerNetwork net = new MultiLayerNetwork(list.build());
        net.init();
        return net;
    }

    private Evaluation evaluate(MultiLayerNetwork net, DataSet data) {
        double loss = net.score(data);
        INDArray out = net.output(data.getFeatures(), false);
        INDArray labels = data.getLabels();
        int n = data.numExamples();
        int correct = 0;
        for (int i = 0; i < n; i++) {
            if (ModelBackend.isAccurate(out.getDouble(i, 0) * 100.0, labels.getDouble(i, 0) * 100.0)) {
                correct++;
            }
        }
        return new Evaluation(loss, (correct * 100.0) / n, n);
    }

    private DataSet toDataSet(List<TrainingExample> examples) {
        int n = examples.size();
        double[][] x = new double[n][];
        double[][] y = new double[n][1];
        for (int i = 0; i < n; i++) {
            TrainingExample e = examples.get(i);
            x[i] = checkWidth(e.input());
            y[i][0] = e.target() / 100.0;
        }
        DataType dt = network.params().dataType();
        return new DataSet(Nd4j.create(x).castTo(dt), Nd4j.create(y).castTo(dt));
    }

    private INDArray toRow(double[] features) {
        return Nd4j.create(new double[][]{checkWidth(features)}).castTo(network.params().dataType());
    }

    private double[] checkWidth(double[] features) {
        if (features == null || features.length != architecture.inputSize()) {
            throw new IllegalArgumentException("expected " + architecture.inputSize() + " features, got "
                    + (features == null ? "null" : features.length));
        }
        return features;
    }

    private void requireReady() {
        if (!state.isReady() || network == null) {
            throw new IllegalStateException("dl4j backend is not loaded");
        }
    }

    private static double clampScore(double v) {
        if (!Double.isFinite(v)) throw new IllegalStateException("non-finite prediction: " + v);
        return Math.max(0.0, Math.min(100.0, v));
    }
}
