package com.chicu.breachml.ml.training;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.ml.backend.EpochStats;
import com.chicu.breachml.ml.persistence.MlJsonMapper;
import com.chicu.breachml.ml.persistence.MlTrainingRunEntity;

import java.time.Instant;
import java.util.List;

public record TrainingRunView(
        Long id,
        Long modelId,
        ModelStatus status,
        String backend,
        double learningRate,
        int epochs,
        int batchSize,
        double validationSplit,
        int currentEpoch,
        int progressPercent,
        int feedbackSamples,
        int bootstrapSamples,
        int trainingSamples,
        int validationSamples,
        Double finalAccuracy,
        Double finalLoss,
        Double validationAccuracy,
        Double validationLoss,
        List<EpochStats> epochHistory,
        Instant startedAt,
        Instant completedAt,
        String errorMessage
) {

    public static TrainingRunView from(MlTrainingRunEntity r, MlJsonMapper json) {
        return new TrainingRunView(
                r.getId(),
                r.getModelId(),
                r.getStatus(),
                r.getBackend(),
                r.getLearningRate(),
                r.getEpochs(),
                r.getBatchSize(),
                r.getValidationSplit(),
                r.getCurrentEpoch(),
                r.getProgressPercent(),
                r.getFeedbackSamples(),
                r.getBootstrapSamples(),
                r.getTrainingSamples(),
                r.getValidationSamples(),
                r.getFinalAccuracy(),
                r.getFinalLoss(),
                r.getValidationAccuracy(),
                r.getValidationLoss(),
                json.readEpochs(r.getEpochHistoryJson()),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getErrorMessage()
        );
    }
}
