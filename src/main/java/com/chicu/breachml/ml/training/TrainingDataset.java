package com.chicu.breachml.ml.training;

import com.chicu.breachml.ml.backend.TrainingExample;

import java.util.List;

/**
 * @param feedbackIds фидбек, реально вошедший в набор (пометим used после успеха)
 */
public record TrainingDataset(
        String datasetId,
        List<TrainingExample> examples,
        List<Long> feedbackIds,
        int feedbackSamples,
        int bootstrapSamples
) {

    public TrainingDataset {
        examples = List.copyOf(examples);
        feedbackIds = List.copyOf(feedbackIds);
    }

    public int size() {
        return examples.size();
    }
}
