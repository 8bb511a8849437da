package com.astrophot.service.centroid;

import com.astrophot.model.Position;

import java.util.Optional;

/** Pixel más brillante refinado con centroide ponderado en una ventana 11x11. */
public class PeakRefineMethod implements CentroidMethod {

    static final double CONFIDENCE = 0.6;
    private static final int HALF_WINDOW = 5;

    @Override
    public String name() { return "peak-refine"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        int px = 0, py = 0;
        double best = Double.NEGATIVE_INFINITY;
        for (int y = 0; y < region.height(); y++) {
            for (int x = 0; x < region.width(); x++) {
                if (region.cutout[y][x] > best) { best = region.cutout[y][x]; px = x; py = y; }
            }
        }
        int x0 = Math.max(0, px - HALF_WINDOW), x1 = Math.min(region.width(), px + HALF_WINDOW + 1);
        int y0 = Math.max(0, py - HALF_WINDOW), y1 = Math.min(region.height(), py + HALF_WINDOW + 1);

        double[] c = region.weightedCentroid(x0, y0, x1, y1, 1.0);
        if (c == null) return Optional.empty();
        Position p = region.toPlane(c[0], c[1]);
        return region.isPlausible(p) ? Optional.of(new Candidate(name(), p, CONFIDENCE)) : Optional.empty();
    }
}
