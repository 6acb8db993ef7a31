package com.chicu.breachml.ml.backend;

public enum BackendState {
    UNLOADED,
    LOADED,
    TRAINED;

    public boolean isReady() {
        return this != UNLOADED;
    }
}
