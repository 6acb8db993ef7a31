package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.backend.BackendChain;
import com.chicu.breachml.ml.backend.ModelArchitecture;
import com.chicu.breachml.ml.backend.ModelBackend;
import com.chicu.breachml.ml.backend.ModelBackendFactory;
import com.chicu.breachml.ml.backend.ModelCache;
import com.chicu.breachml.ml.backend.ModelSnapshot;
import com.chicu.breachml.ml.backend.ModelWeights;
import com.chicu.breachml.ml.backend.NeuralNetworkBackend;
import com.chicu.breachml.ml.backend.NeuralNetworkBackendFactory;
import com.chicu.breachml.ml.backend.TrainingConfig;
import com.chicu.breachml.ml.backend.TrainingExample;
import com.chicu.breachml.ml.backend.TrainingResult;
import com.chicu.breachml.ml.backend.TensorRecord;
import com.chicu.breachml.ml.backend.WeightFormat;
import com.chicu.breachml.ml.features.BreachFeatures;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlTrainingRunEntity;
import com.chicu.breachml.ml.registry.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TrainingOrchestratorTest {

    private static final String ORG = "org-1";
    private static final long MODEL_ID = 5L;
    private static final long RUN_ID = 11L;

    private ModelRegistry registry;
    private TrainingDatasetBuilder datasetBuilder;
    private TrainingRunRecorder recorder;
    private BackendChain backendChain;
    private ModelCache modelCache;
    private MlProperties props;

    private MlModelEntity model;
    private ModelBackend primaryBackend;
    private ModelBackendFactory primary;
    private NeuralNetworkBackendFactory fallback;

    private TrainingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistry.class);
        datasetBuilder = mock(TrainingDatasetBuilder.class);
        recorder = mock(TrainingRunRecorder.class);
        backendChain = mock(BackendChain.class);
        modelCache = mock(ModelCache.class);

        props = new MlProperties();
        props.getModel().setSeed(42L);

        model = MlModelEntity.builder()
                .id(MODEL_ID)
                .organisationId(ORG)
                .predictionType(PredictionType.BREACH_PROBABILITY)
                .version(1)
                .status(ModelStatus.TRAINING)
                .active(true)
                .learningRate(0.1)
                .epochs(20)
                .batchSize(32)
                .build();

        when(registry.getOrCreate(eq(ORG), any())).thenReturn(model);
        when(registry.snapshotOf(model)).thenReturn(snapshot(null));
        when(recorder.open(any(), any())).thenReturn(MlTrainingRunEntity.builder().id(RUN_ID).build());
        when(datasetBuilder.build(model)).thenReturn(dataset(20));

        // тензорный бэкенд без нативной части: падает на обучении
        primaryBackend = mock(ModelBackend.class);
        when(primaryBackend.name()).thenReturn("dl4j");
        when(primaryBackend.train(anyList(), any(), any())).thenThrow(new IllegalStateException("nd4j backend unavailable"));
        primary = mock(ModelBackendFactory.class);
        when(primary.name()).thenReturn("dl4j");
        when(primary.weightFormat()).thenReturn(WeightFormat.TENSOR_LIST);
        when(primary.defaultHiddenLayers()).thenReturn(List.of(64, 32));
        when(primary.create(any())).thenReturn(primaryBackend);

        fallback = new NeuralNetworkBackendFactory(props);
        when(backendChain.factories()).thenReturn(List.of(primary, fallback));

        orchestrator = new TrainingOrchestrator(registry, datasetBuilder, recorder, backendChain, modelCache, props);
    }

    private static ModelSnapshot snapshot(ModelWeights weights) {
        return ModelSnapshot.of(MODEL_ID, 0, ORG, BreachFeatures.NAMES, List.of(32, 16), weights, null, 0);
    }

    private static TrainingDataset dataset(int size) {
        List<TrainingExample> examples = new ArrayList<>();
        int n = BreachFeatures.NAMES.size();
        for (int i = 0; i < size; i++) {
            double[] x = new double[n];
            double level = (i % 2 == 0) ? 0.1 : 0.9;
            for (int j = 0; j < n; j++) x[j] = level;
            examples.add(new TrainingExample(x, level * 100));
        }
        return new TrainingDataset("ds-1", examples, List.of(1L, 2L), 2, size - 2);
    }

    @Test
    void primaryFailure_fallsBackToFeedForward_andSwapsWeights() {
        TrainingOutcome outcome = orchestrator.train(ORG, PredictionType.BREACH_PROBABILITY, TrainingOverrides.none(), () -> false);

        assertTrue(outcome.success(), outcome.error());
        assertEquals(NeuralNetworkBackend.NAME, outcome.backend());
        assertEquals(MODEL_ID, outcome.modelId());
        assertEquals(RUN_ID, outcome.trainingRunId());
        assertEquals(20, outcome.epochHistory().size());
        assertEquals(2, outcome.feedbackSamples());
        assertEquals(18, outcome.bootstrapSamples());
        assertNotNull(outcome.accuracy());

        verify(recorder).completeAtomic(eq(RUN_ID), eq(MODEL_ID), eq(NeuralNetworkBackend.NAME), eq(List.of(16, 8)),
                argThat(w -> w.format() == WeightFormat.DENSE_LAYERS), any(TrainingResult.class), eq(List.of(1L, 2L)));
        verify(modelCache).invalidate(MODEL_ID);
        verify(recorder, never()).fail(anyLong(), anyString());
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordedHiddenLayers_matchExportedWeightShapes() {
        ArgumentCaptor<List<Integer>> layers = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<ModelWeights> weights = ArgumentCaptor.forClass(ModelWeights.class);

        assertTrue(orchestrator.train(ORG, null, TrainingOverrides.none(), () -> false).success());

        verify(recorder).completeAtomic(eq(RUN_ID), eq(MODEL_ID), any(), layers.capture(), weights.capture(), any(), any());
        int[] sizes = new ModelArchitecture(BreachFeatures.NAMES.size(), layers.getValue()).layerSizes();
        List<double[]> exported = weights.getValue().layers();
        assertEquals(sizes.length - 1, exported.size());
        for (int l = 0; l < exported.size(); l++) {
            assertEquals(sizes[l] * sizes[l + 1], exported.get(l).length, "layer " + l);
        }

        // та же модель загружается бэкендом, собранным по записанным слоям
        ModelSnapshot stored = ModelSnapshot.of(MODEL_ID, 1, ORG, BreachFeatures.NAMES, layers.getValue(),
                weights.getValue(), 90.0, 0);
        assertTrue(fallback.create(stored.architectureFor(fallback)).loadWeights(stored.weights()));
    }

    @Test
    void fallbackWithChangedConfig_stillRecordsTrainedLayers() {
        props.getModel().setHiddenLayers(new ArrayList<>(List.of(12)));

        orchestrator.train(ORG, null, TrainingOverrides.none(), () -> false);

        verify(recorder).completeAtomic(eq(RUN_ID), eq(MODEL_ID), eq(NeuralNetworkBackend.NAME), eq(List.of(12)),
                argThat(w -> w.layers().size() == 2), any(), any());
    }

    @Test
    void progress_isWrittenEveryNEpochsAndOnLastEpoch() {
        orchestrator.train(ORG, null, TrainingOverrides.none(), null);

        verify(recorder).progress(eq(RUN_ID), eq(10), eq(20), anyList());
        verify(recorder).progress(eq(RUN_ID), eq(20), eq(20), anyList());
        verify(recorder, times(2)).progress(anyLong(), anyInt(), anyInt(), anyList());
    }

    @Test
    void primaryWithCompatibleWeights_warmStartsWithoutInitialize() {
        when(registry.snapshotOf(model)).thenReturn(snapshot(ModelWeights.tensors(List.of(
                new TensorRecord(new double[]{0.1, 0.2}, new long[]{1, 2})))));
        reset(primaryBackend);
        when(primaryBackend.name()).thenReturn("dl4j");
        when(primaryBackend.loadWeights(any())).thenReturn(true);
        when(primaryBackend.train(anyList(), any(), any()))
                .thenReturn(new TrainingResult(0.01, 90.0, List.of(), 20, 0));
        when(primaryBackend.exportWeights()).thenReturn(ModelWeights.tensors(List.of()));

        TrainingOutcome outcome = orchestrator.train(ORG, null, null, null);

        assertTrue(outcome.success());
        assertEquals("dl4j", outcome.backend());
        verify(primaryBackend, never()).initialize();
        // тёплый старт идёт на объявленной архитектуре модели, а не на дефолтах бэкенда
        verify(primary).create(new ModelArchitecture(BreachFeatures.NAMES.size(), List.of(32, 16)));
        verify(recorder).completeAtomic(eq(RUN_ID), eq(MODEL_ID), eq("dl4j"), eq(List.of(32, 16)), any(), any(), any());
        verify(modelCache).invalidate(MODEL_ID);
    }

    @Test
    void allBackendsFail_runFails_andModelIsUntouched() {
        ModelBackendFactory broken = mock(ModelBackendFactory.class);
        when(broken.name()).thenReturn("feed-forward");
        when(broken.defaultHiddenLayers()).thenReturn(List.of(16, 8));
        when(broken.create(any())).thenThrow(new IllegalArgumentException("bad architecture"));
        when(backendChain.factories()).thenReturn(List.of(primary, broken));

        TrainingOutcome outcome = orchestrator.train(ORG, null, TrainingOverrides.none(), () -> false);

        assertFalse(outcome.success());
        assertTrue(outcome.error().startsWith("all training backends failed"));
        verify(recorder).fail(eq(RUN_ID), startsWith("all training backends failed"));
        verify(recorder, never()).completeAtomic(any(), any(), any(), any(), any(), any(), any());
        verifyNoInteractions(modelCache);
    }

    @Test
    void cancellation_marksRunCancelled() {
        when(backendChain.factories()).thenReturn(List.of(fallback));

        TrainingOutcome outcome = orchestrator.train(ORG, null, TrainingOverrides.none(), () -> true);

        assertFalse(outcome.success());
        assertEquals(TrainingOrchestrator.CANCELLED, outcome.error());
        verify(recorder).fail(RUN_ID, TrainingOrchestrator.CANCELLED);
        verify(recorder, never()).completeAtomic(any(), any(), any(), any(), any(), any(), any());
        verifyNoInteractions(modelCache);
    }

    @Test
    void emptyDataset_failsRun() {
        when(datasetBuilder.build(model)).thenReturn(new TrainingDataset("ds-0", List.of(), List.of(), 0, 0));

        TrainingOutcome outcome = orchestrator.train(ORG, null, TrainingOverrides.none(), () -> false);

        assertFalse(outcome.success());
        assertTrue(outcome.error().startsWith("no training examples"));
        verify(recorder).fail(eq(RUN_ID), startsWith("no training examples"));
        verify(backendChain, never()).factories();
    }

    @Test
    void completionFailure_isReportedAsFailedRun() {
        when(recorder.completeAtomic(any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("training run 11 is already FAILED"));

        TrainingOutcome outcome = orchestrator.train(ORG, null, TrainingOverrides.none(), () -> false);

        assertFalse(outcome.success());
        verify(recorder).fail(RUN_ID, "training run 11 is already FAILED");
        verifyNoInteractions(modelCache);
    }

    @Test
    void resolveConfig_overridesWinOverModelSettings_whichWinOverDefaults() {
        model.setLearningRate(0.05);
        model.setEpochs(40);
        model.setBatchSize(16);

        TrainingConfig fromModel = orchestrator.resolveConfig(model, null);
        assertEquals(0.05, fromModel.learningRate());
        assertEquals(40, fromModel.epochs());
        assertEquals(16, fromModel.batchSize());
        assertEquals(0.2, fromModel.validationSplit());

        TrainingConfig overridden = orchestrator.resolveConfig(model, TrainingOverrides.builder()
                .epochs(5)
                .validationSplit(0.1)
                .build());
        assertEquals(0.05, overridden.learningRate());
        assertEquals(5, overridden.epochs());
        assertEquals(16, overridden.batchSize());
        assertEquals(0.1, overridden.validationSplit());
    }

    @Test
    void invalidOverride_isRejectedBeforeRunOpens() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.train(ORG, null,
                TrainingOverrides.builder().learningRate(-1.0).build(), () -> false));
        verify(recorder, never()).open(any(), any());
    }
}
