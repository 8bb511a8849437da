package com.astrophot.workflow;

import com.astrophot.model.Position;

import java.util.concurrent.CompletableFuture;

/**
 * Punto en el que la sesión se detiene hasta que alguien externo decide:
 * dar una posición, saltar el cuadro o parar.
 * <p>
 * Se puede resolver desde cualquier hilo; la sesión continúa en su propio executor.
 */
public class PendingDecision {

    public enum Reason {
        /** Seguimiento automático desactivado o primer cuadro tras reanudar sin ancla. */
        POSITION_REQUIRED,
        /** El rastreador perdió la estrella. */
        TRACKING_LOST
    }

    private final int frameIndex;
    private final String frameName;
    private final Reason reason;
    private final Position lastKnown;
    private final CompletableFuture<Decision> future = new CompletableFuture<>();

    PendingDecision(int frameIndex, String frameName, Reason reason, Position lastKnown) {
        this.frameIndex = frameIndex;
        this.frameName = frameName;
        this.reason = reason;
        this.lastKnown = lastKnown;
    }

    public int frameIndex() { return frameIndex; }
    public String frameName() { return frameName; }
    public Reason reason() { return reason; }
    public Position lastKnown() { return lastKnown; }

    public boolean supplyPosition(Position p) {
        return future.complete(Decision.position(p));
    }

    public boolean skip() {
        return future.complete(Decision.skip());
    }

    public boolean stop() {
        return future.complete(Decision.stop());
    }

    public boolean isResolved() {
        return future.isDone();
    }

    CompletableFuture<Decision> future() {
        return future;
    }

    @Override
    public String toString() {
        return reason + " @ " + frameIndex + " (" + frameName + ")";
    }
}
