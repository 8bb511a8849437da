package com.astrophot.model;

public enum WorkflowMode {
    IDLE,
    PRE_SELECTING,
    SEQUENTIAL_MANUAL,
    BATCH_AUTOMATIC,
    PAUSED,
    COMPLETED;

    public boolean isActive() {
        return this == PRE_SELECTING || this == SEQUENTIAL_MANUAL || this == BATCH_AUTOMATIC;
    }

    public boolean measures() {
        return this == SEQUENTIAL_MANUAL || this == BATCH_AUTOMATIC;
    }
}
