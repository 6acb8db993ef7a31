package com.chicu.breachml.ml.training;

import com.chicu.breachml.ml.backend.EpochStats;
import lombok.Builder;

import java.util.List;

@Builder
public record TrainingOutcome(
        boolean success,
        Long modelId,
        Long trainingRunId,
        String backend,
        Double accuracy,
        Double loss,
        Double validationAccuracy,
        List<EpochStats> epochHistory,
        int trainingSamples,
        int feedbackSamples,
        int bootstrapSamples,
        String error
) {

    public TrainingOutcome {
        epochHistory = epochHistory == null ? List.of() : List.copyOf(epochHistory);
    }

    public static TrainingOutcome rejected(Long modelId, String reason) {
        return TrainingOutcome.builder()
                .success(false)
                .modelId(modelId)
                .error(reason)
                .build();
    }
}
