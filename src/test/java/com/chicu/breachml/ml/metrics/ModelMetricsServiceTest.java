package com.chicu.breachml.ml.metrics;

import com.chicu.breachml.common.enums.FeedbackType;
import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.persistence.MlFeedbackRepository;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlTrainingRunEntity;
import com.chicu.breachml.ml.persistence.MlTrainingRunRepository;
import com.chicu.breachml.ml.registry.ModelRegistry;
import com.chicu.breachml.ml.training.TrainingRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelMetricsServiceTest {

    private static final String ORG = "org-1";
    private static final long MODEL_ID = 9L;

    @Mock private ModelRegistry registry;
    @Mock private MlFeedbackRepository feedbackRepo;
    @Mock private MlTrainingRunRepository runRepo;
    @Mock private TrainingRuntime trainingRuntime;

    private final MlJsonMapper json = new MlJsonMapper(new ObjectMapper());
    private ModelMetricsService service;
    private MlModelEntity model;

    @BeforeEach
    void setUp() {
        service = new ModelMetricsService(registry, feedbackRepo, runRepo, trainingRuntime, json, new MlProperties());
        model = MlModelEntity.builder()
                .id(MODEL_ID)
                .organisationId(ORG)
                .predictionType(PredictionType.BREACH_PROBABILITY)
                .version(2)
                .status(ModelStatus.ACTIVE)
                .active(true)
                .totalPredictions(40)
                .correctPredictions(6)
                .feedbackCount(9)
                .trainingAccuracy(80.0)
                .lastTrainedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
        when(registry.findActive(ORG, PredictionType.BREACH_PROBABILITY)).thenReturn(Optional.of(model));
        when(runRepo.findTop10ByModelIdOrderByStartedAtDescIdDesc(MODEL_ID)).thenReturn(List.of());
    }

    private void feedback(long correct, long incorrect, long partial) {
        when(feedbackRepo.countByModelId(MODEL_ID)).thenReturn(correct + incorrect + partial);
        when(feedbackRepo.countByModelIdAndFeedbackType(MODEL_ID, FeedbackType.CORRECT)).thenReturn(correct);
        when(feedbackRepo.countByModelIdAndFeedbackType(MODEL_ID, FeedbackType.INCORRECT)).thenReturn(incorrect);
        when(feedbackRepo.countByModelIdAndFeedbackType(MODEL_ID, FeedbackType.PARTIALLY_CORRECT)).thenReturn(partial);
    }

    @Test
    void nineFeedbackRows_areNotEnoughForTraining() {
        feedback(6, 2, 1);

        ModelMetrics m = service.getModelMetrics(ORG);

        assertEquals(9, m.feedbackStats().total());
        assertFalse(m.trainingReady());
        assertEquals(0.75, m.accuracy(), 1e-9);
        assertEquals(40, m.totalPredictions());
        assertEquals(2, m.version());
    }

    @Test
    void tenFeedbackRows_makeModelTrainingReady() {
        feedback(6, 2, 2);

        assertTrue(service.getModelMetrics(ORG).trainingReady());
    }

    @Test
    void withoutJudgedFeedback_accuracyFallsBackToTrainingAccuracy() {
        feedback(0, 0, 3);

        ModelMetrics m = service.getModelMetrics(ORG);

        assertEquals(0.8, m.accuracy(), 1e-9);
        assertEquals(80.0, m.trainingAccuracy());
    }

    @Test
    void accuracy_isNullWithoutAnySignal() {
        assertNull(ModelMetricsService.accuracy(FeedbackStats.empty(), null));
    }

    @Test
    void noModel_returnsEmptyMetricsWithoutCreatingOne() {
        when(registry.findActive(ORG, PredictionType.BREACH_PROBABILITY)).thenReturn(Optional.empty());
        when(trainingRuntime.isRunning(ORG, PredictionType.BREACH_PROBABILITY)).thenReturn(true);

        ModelMetrics m = service.getModelMetrics(ORG);

        assertNull(m.modelId());
        assertNull(m.accuracy());
        assertFalse(m.trainingReady());
        assertTrue(m.trainingRunning());
        assertEquals(FeedbackStats.empty(), m.feedbackStats());
        verify(registry, never()).getOrCreate(any(), any());
        verifyNoInteractions(feedbackRepo);
    }

    @Test
    void recentRuns_areMappedWithEpochHistory() {
        feedback(1, 0, 0);
        MlTrainingRunEntity run = MlTrainingRunEntity.builder()
                .id(3L)
                .modelId(MODEL_ID)
                .organisationId(ORG)
                .predictionType(PredictionType.BREACH_PROBABILITY)
                .status(ModelStatus.FAILED)
                .learningRate(0.01)
                .epochs(100)
                .batchSize(32)
                .validationSplit(0.2)
                .epochHistoryJson("[{\"epoch\":0,\"loss\":0.3,\"accuracy\":40.0}]")
                .errorMessage("cancelled")
                .build();
        when(runRepo.findTop10ByModelIdOrderByStartedAtDescIdDesc(MODEL_ID)).thenReturn(List.of(run));

        ModelMetrics m = service.getModelMetrics(ORG);

        assertEquals(1, m.recentTrainingRuns().size());
        assertEquals(ModelStatus.FAILED, m.recentTrainingRuns().get(0).status());
        assertEquals("cancelled", m.recentTrainingRuns().get(0).errorMessage());
        assertEquals(1, m.recentTrainingRuns().get(0).epochHistory().size());
    }
}
