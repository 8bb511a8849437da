package com.astrophot.service.centroid;

import com.astrophot.model.Position;

/** Posición propuesta por un método de centroide. */
public final class Candidate {
    public final String method;
    public final Position position;
    public final double confidence;

    public Candidate(String method, Position position, double confidence) {
        this.method = method;
        this.position = position;
        this.confidence = confidence;
    }

    @Override
    public String toString() {
        return method + " " + position + " conf=" + confidence;
    }
}
