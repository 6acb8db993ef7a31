package com.chicu.breachml.ml.backend;

import java.util.List;

public record TrainingResult(
        double finalLoss,
        double finalAccuracy,
        List<EpochStats> epochHistory,
        int trainingSamples,
        int validationSamples
) {

    public TrainingResult {
        epochHistory = epochHistory == null ? List.of() : List.copyOf(epochHistory);
    }

    public EpochStats lastEpoch() {
        return epochHistory.isEmpty() ? null : epochHistory.get(epochHistory.size() - 1);
    }
}
