package com.astrophot.service.centroid;

import com.astrophot.model.Position;

import java.util.Optional;

public class CenterOfMassMethod implements CentroidMethod {

    static final double CONFIDENCE = 0.8;

    @Override
    public String name() { return "center-of-mass"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        double[] c = region.weightedCentroid(0, 0, region.width(), region.height(), 1.0);
        if (c == null) return Optional.empty();
        Position p = region.toPlane(c[0], c[1]);
        return region.isPlausible(p) ? Optional.of(new Candidate(name(), p, CONFIDENCE)) : Optional.empty();
    }
}
