package com.astrophot.model;

public class TrackResult {
    public enum Status { FOUND, LOST }

    public static final double LOST_CONFIDENCE = 0.1;

    public final Status status;
    public final Position position;
    public final double confidence;
    public final String method;

    private TrackResult(Status status, Position position, double confidence, String method) {
        this.status = status;
        this.position = position;
        this.confidence = confidence;
        this.method = method;
    }

    public static TrackResult found(Position position, double confidence, String method) {
        return new TrackResult(Status.FOUND, position, confidence, method);
    }

    // Se degrada a la posición esperada
    public static TrackResult lost(Position expected) {
        return new TrackResult(Status.LOST, expected, LOST_CONFIDENCE, "fallback");
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    @Override
    public String toString() {
        return status + " " + position + " conf=" + confidence + " [" + method + "]";
    }
}
