package com.astrophot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Vista inmutable del estado de una sesión, segura de leer desde otro hilo.
 * Las posiciones nulas son cuadros saltados o fallidos.
 */
public final class SessionSnapshot {
    public final WorkflowMode mode;
    public final WorkflowMode pausedFromMode;
    public final int currentFrameIndex;
    public final int viewedFrameIndex;
    public final int frameCount;
    public final List<Position> positions;
    public final List<PhotometryResult> results;
    public final List<FrameFailure> failures;
    public final boolean awaitingDecision;

    public SessionSnapshot(WorkflowMode mode, WorkflowMode pausedFromMode, int currentFrameIndex,
                           int viewedFrameIndex, int frameCount, List<Position> positions,
                           List<PhotometryResult> results, List<FrameFailure> failures, boolean awaitingDecision) {
        this.mode = mode;
        this.pausedFromMode = pausedFromMode;
        this.currentFrameIndex = currentFrameIndex;
        this.viewedFrameIndex = viewedFrameIndex;
        this.frameCount = frameCount;
        this.positions = Collections.unmodifiableList(new ArrayList<>(positions));
        this.results = List.copyOf(results);
        this.failures = List.copyOf(failures);
        this.awaitingDecision = awaitingDecision;
    }

    public Optional<Position> positionAt(int index) {
        return index >= 0 && index < positions.size() ? Optional.ofNullable(positions.get(index)) : Optional.empty();
    }
}
