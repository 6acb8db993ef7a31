package com.chicu.breachml.ml.metrics;

import com.chicu.breachml.common.enums.FeedbackType;
import com.chicu.breachml.ml.MlProperties;
import com.chicu.breachml.ml.persistence.MlFeedbackRepository;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlModelEntity;
import com.chicu.breachml.ml.persistence.MlTrainingRunRepository;
import com.chicu.breachml.ml.registry.ModelRegistry;
import com.chicu.breachml.ml.training.TrainingRunView;
import com.chicu.breachml.ml.training.TrainingRuntime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelMetricsService {

    private final ModelRegistry registry;
    private final MlFeedbackRepository feedbackRepo;
    private final MlTrainingRunRepository runRepo;
    private final TrainingRuntime trainingRuntime;
    private final MlJsonMapper json;
    private final MlProperties props;

    public ModelMetrics getModelMetrics(String organisationId) {
        Optional<MlModelEntity> found = registry.findActive(organisationId, ModelRegistry.DEFAULT_TYPE);
        boolean running = trainingRuntime.isRunning(organisationId, ModelRegistry.DEFAULT_TYPE);
        if (found.isEmpty()) {
            return ModelMetrics.builder()
                    .organisationId(organisationId)
                    .feedbackStats(FeedbackStats.empty())
                    .trainingReady(false)
                    .trainingRunning(running)
                    .build();
        }

        MlModelEntity model = found.get();
        Long modelId = model.getId();

        FeedbackStats stats = new FeedbackStats(
                feedbackRepo.countByModelId(modelId),
                feedbackRepo.countByModelIdAndFeedbackType(modelId, FeedbackType.CORRECT),
                feedbackRepo.countByModelIdAndFeedbackType(modelId, FeedbackType.INCORRECT),
                feedbackRepo.countByModelIdAndFeedbackType(modelId, FeedbackType.PARTIALLY_CORRECT)
        );

        List<TrainingRunView> runs = runRepo.findTop10ByModelIdOrderByStartedAtDescIdDesc(modelId).stream()
                .map(r -> TrainingRunView.from(r, json))
                .toList();

        return ModelMetrics.builder()
                .organisationId(organisationId)
                .modelId(modelId)
                .version(model.getVersion())
                .status(model.getStatus())
                .accuracy(accuracy(stats, model.getTrainingAccuracy()))
                .totalPredictions(model.getTotalPredictions())
                .correctPredictions(model.getCorrectPredictions())
                .feedbackCount(model.getFeedbackCount())
                .trainingAccuracy(model.getTrainingAccuracy())
                .validationAccuracy(model.getValidationAccuracy())
                .lastTrainedAt(model.getLastTrainedAt())
                .feedbackStats(stats)
                .trainingReady(stats.total() >= props.getMetrics().getTrainingReadyFeedback())
                .trainingRunning(running)
                .recentTrainingRuns(runs)
                .build();
    }

    /** Последние 20 прогонов по всем моделям организации. */
    public List<TrainingRunView> listTrainingRuns(String organisationId) {
        return runRepo.findTop20ByOrganisationIdOrderByStartedAtDescIdDesc(organisationId).stream()
                .map(r -> TrainingRunView.from(r, json))
                .toList();
    }

    static Double accuracy(FeedbackStats stats, Double trainingAccuracy) {
        long judged = stats.correct() + stats.incorrect();
        if (judged > 0) {
            return (double) stats.correct() / judged;
        }
        return trainingAccuracy != null ? trainingAccuracy / 100.0 : null;
    }
}
