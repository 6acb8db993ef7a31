package com.chicu.breachml.ml.backend;

public class TrainingCancelledException extends RuntimeException {

    public TrainingCancelledException(int epoch) {
        super("cancelled at epoch " + epoch);
    }
}
