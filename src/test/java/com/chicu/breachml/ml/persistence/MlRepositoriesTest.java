package com.chicu.breachml.ml.persistence;

import com.chicu.breachml.common.enums.FeedbackType;
import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.common.enums.PredictionType;
import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.common.enums.SourceLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class MlRepositoriesTest {

    private static final String ORG = "org-1";

    @Autowired MlModelRepository modelRepo;
    @Autowired MlPredictionRepository predictionRepo;
    @Autowired MlFeedbackRepository feedbackRepo;
    @Autowired MlTrainingRunRepository runRepo;

    private MlModelEntity model;

    @BeforeEach
    void setUp() {
        model = modelRepo.saveAndFlush(model(1));
    }

    private static MlModelEntity model(int version) {
        return MlModelEntity.builder()
                .organisationId(ORG)
                .predictionType(PredictionType.BREACH_PROBABILITY)
                .version(version)
                .status(ModelStatus.TRAINING)
                .active(true)
                .inputFeaturesJson("[\"expiryRiskScore\"]")
                .hiddenLayersJson("[16,8]")
                .outputActivation("sigmoid")
                .learningRate(0.01)
                .epochs(100)
                .batchSize(32)
                .build();
    }

    private MlPredictionEntity prediction(String entityId, RiskCategory category) {
        return predictionRepo.saveAndFlush(MlPredictionEntity.builder()
                .modelId(model.getId())
                .organisationId(ORG)
                .entityId(entityId)
                .statisticalScore(60)
                .statisticalConfidence(85)
                .combinedScore(60)
                .combinedConfidence(85)
                .riskCategory(category)
                .sourceLabel(SourceLabel.STATISTICAL)
                .inputFeaturesJson("{}")
                .expiresAt(Instant.parse("2030-01-01T00:00:00Z"))
                .build());
    }

    private MlFeedbackEntity feedback(Long predictionId, FeedbackType type, Integer correctedScore, boolean used) {
        return feedbackRepo.saveAndFlush(MlFeedbackEntity.builder()
                .predictionId(predictionId)
                .modelId(model.getId())
                .organisationId(ORG)
                .feedbackType(type)
                .correctedScore(correctedScore)
                .usedForTraining(used)
                .build());
    }

    private MlTrainingRunEntity run(ModelStatus status) {
        return runRepo.saveAndFlush(MlTrainingRunEntity.builder()
                .modelId(model.getId())
                .organisationId(ORG)
                .predictionType(PredictionType.BREACH_PROBABILITY)
                .status(status)
                .learningRate(0.01)
                .epochs(100)
                .batchSize(32)
                .validationSplit(0.2)
                .epochHistoryJson("[]")
                .startedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build());
    }

    @Test
    void counters_areIncrementedAtomically() {
        assertEquals(1, modelRepo.incrementTotalPredictions(model.getId()));
        modelRepo.incrementTotalPredictions(model.getId());
        modelRepo.incrementFeedback(model.getId(), 1);
        modelRepo.incrementFeedback(model.getId(), 0);

        MlModelEntity reloaded = modelRepo.findById(model.getId()).orElseThrow();
        assertEquals(2, reloaded.getTotalPredictions());
        assertEquals(2, reloaded.getFeedbackCount());
        assertEquals(1, reloaded.getCorrectPredictions());
    }

    @Test
    void activeModel_isLatestActiveVersion() {
        MlModelEntity v2 = model(2);
        v2.setActive(false);
        modelRepo.saveAndFlush(v2);

        assertEquals(1, modelRepo.findFirstByOrganisationIdAndPredictionTypeAndActiveTrueOrderByVersionDesc(
                ORG, PredictionType.BREACH_PROBABILITY).orElseThrow().getVersion());
        assertEquals(2, modelRepo.findFirstByOrganisationIdAndPredictionTypeOrderByVersionDesc(
                ORG, PredictionType.BREACH_PROBABILITY).orElseThrow().getVersion());
    }

    @Test
    void duplicateVersion_violatesUniqueConstraint() {
        assertThrows(DataIntegrityViolationException.class, () -> modelRepo.saveAndFlush(model(1)));
    }

    @Test
    void findTrainable_skipsUsedAndUnlabelledFeedback() {
        Long p = prediction("e-1", RiskCategory.HIGH).getId();
        MlFeedbackEntity correct = feedback(p, FeedbackType.CORRECT, null, false);
        MlFeedbackEntity corrected = feedback(p, FeedbackType.INCORRECT, 30, false);
        feedback(p, FeedbackType.INCORRECT, null, false);
        feedback(p, FeedbackType.PARTIALLY_CORRECT, 55, true);

        List<MlFeedbackEntity> trainable = feedbackRepo.findTrainable(model.getId(), PageRequest.of(0, 1000));

        assertEquals(List.of(correct.getId(), corrected.getId()), trainable.stream().map(MlFeedbackEntity::getId).toList());
        assertEquals(1, feedbackRepo.findTrainable(model.getId(), PageRequest.of(0, 1)).size());
        assertEquals(4, feedbackRepo.countByModelId(model.getId()));
        assertEquals(2, feedbackRepo.countByModelIdAndFeedbackType(model.getId(), FeedbackType.INCORRECT));
    }

    @Test
    void skippedFeedback_leavesTheTrainingWindow() {
        Long p = prediction("e-1", RiskCategory.HIGH).getId();
        MlFeedbackEntity broken = feedback(p, FeedbackType.CORRECT, null, false);
        MlFeedbackEntity good = feedback(p, FeedbackType.INCORRECT, 40, false);

        assertEquals(broken.getId(), feedbackRepo.findTrainable(model.getId(), PageRequest.of(0, 1)).get(0).getId());

        assertEquals(1, feedbackRepo.markSkippedForTraining(List.of(broken.getId())));

        List<MlFeedbackEntity> window = feedbackRepo.findTrainable(model.getId(), PageRequest.of(0, 1));
        assertEquals(List.of(good.getId()), window.stream().map(MlFeedbackEntity::getId).toList());
        assertTrue(feedbackRepo.findById(broken.getId()).orElseThrow().isTrainingSkipped());
        assertFalse(feedbackRepo.findById(broken.getId()).orElseThrow().isUsedForTraining());
    }

    @Test
    void markUsedForTraining_setsRunIdOnlyOnce() {
        Long p = prediction("e-1", RiskCategory.HIGH).getId();
        MlFeedbackEntity a = feedback(p, FeedbackType.CORRECT, null, false);
        MlFeedbackEntity b = feedback(p, FeedbackType.INCORRECT, 20, false);

        assertEquals(2, feedbackRepo.markUsedForTraining(List.of(a.getId(), b.getId()), 7L));
        assertEquals(0, feedbackRepo.markUsedForTraining(List.of(a.getId()), 8L));

        assertEquals(0, feedbackRepo.countByModelIdAndUsedForTrainingFalse(model.getId()));
        assertEquals(7L, feedbackRepo.findById(a.getId()).orElseThrow().getTrainingRunId());
    }

    @Test
    void updateProgress_onlyTouchesRunningRuns() {
        MlTrainingRunEntity running = run(ModelStatus.TRAINING);
        MlTrainingRunEntity failed = run(ModelStatus.FAILED);

        assertEquals(1, runRepo.updateProgress(running.getId(), 10, 10, "[{\"epoch\":9}]"));
        assertEquals(0, runRepo.updateProgress(failed.getId(), 10, 10, "[]"));

        MlTrainingRunEntity reloaded = runRepo.findById(running.getId()).orElseThrow();
        assertEquals(10, reloaded.getCurrentEpoch());
        assertEquals(10, reloaded.getProgressPercent());
        assertTrue(runRepo.existsByModelIdAndStatus(model.getId(), ModelStatus.FAILED));
        assertEquals(2, runRepo.findTop10ByModelIdOrderByStartedAtDescIdDesc(model.getId()).size());
    }

    @Test
    void search_filtersByEntityAndCategory_newestFirst() {
        MlPredictionEntity first = prediction("e-1", RiskCategory.HIGH);
        MlPredictionEntity second = prediction("e-1", RiskCategory.LOW);
        prediction("e-2", RiskCategory.HIGH);

        assertEquals(3, predictionRepo.search(ORG, null, null, PageRequest.of(0, 50)).size());
        assertEquals(List.of(second.getId(), first.getId()),
                predictionRepo.search(ORG, "e-1", null, PageRequest.of(0, 50)).stream().map(MlPredictionEntity::getId).toList());
        assertEquals(2, predictionRepo.search(ORG, null, RiskCategory.HIGH, PageRequest.of(0, 50)).size());
        assertEquals(1, predictionRepo.search(ORG, null, null, PageRequest.of(0, 1)).size());
        assertTrue(predictionRepo.search("other", null, null, PageRequest.of(0, 50)).isEmpty());

        assertTrue(predictionRepo.findByIdAndOrganisationId(first.getId(), ORG).isPresent());
        assertTrue(predictionRepo.findByIdAndOrganisationId(first.getId(), "other").isEmpty());
    }
}
