package com.lottointel.activo.model;

public enum PipelineStage {
    IDLE,
    FETCHING,
    NORMALIZING,
    DEDUPLICATING,
    SAVING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
