package com.astrophot.service.centroid;

import com.astrophot.model.Position;

import java.util.Optional;

/** Acepta la predicción por momento si difiere de la esperada y cae dentro del radio. */
public class MomentumMethod implements CentroidMethod {

    static final double CONFIDENCE = 0.3;

    @Override
    public String name() { return "momentum"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        Position predicted = region.searchCenter;
        if (predicted.equals(region.expected)) return Optional.empty();
        if (predicted.distanceTo(region.expected) > region.radius) return Optional.empty();
        return Optional.of(new Candidate(name(), predicted, CONFIDENCE));
    }
}
