package com.astrophot.service.centroid;

import com.astrophot.model.Position;

import java.util.Optional;

/** Centroide con pesos elevados a 1.5 para enfatizar el núcleo de la estrella. */
public class PeakWeightedMethod implements CentroidMethod {

    @Override
    public String name() { return "peak-weighted"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        double[] c = region.weightedCentroid(0, 0, region.width(), region.height(), 1.5);
        if (c == null) return Optional.empty();
        Position p = region.toPlane(c[0], c[1]);
        if (!region.isPlausible(p)) return Optional.empty();

        double confidence = (region.peak - region.threshold) / (Math.abs(region.peak) + 1);
        return Optional.of(new Candidate(name(), p, Math.max(0.0, Math.min(1.0, confidence))));
    }
}
