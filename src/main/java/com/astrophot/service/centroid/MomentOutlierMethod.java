package com.astrophot.service.centroid;

import com.astrophot.model.Position;

import java.util.Optional;

/**
 * Primer momento de los pixeles sobre el umbral, sin rechazo de valores atípicos.
 * La confianza depende de la compacidad: menos pixeles sobre el umbral, más confianza.
 */
public class MomentOutlierMethod implements CentroidMethod {

    @Override
    public String name() { return "moment"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        int starPixels = 0;
        for (double[] row : region.cutout)
            for (double v : row)
                if (v > region.threshold) starPixels++;
        if (starPixels == 0) return Optional.empty();

        double[] c = region.weightedCentroid(0, 0, region.width(), region.height(), 1.0);
        if (c == null) return Optional.empty();
        Position p = region.toPlane(c[0], c[1]);
        if (!region.isPlausible(p)) return Optional.empty();

        double confidence = Math.min(1.0, 50.0 / (starPixels + 10));
        return Optional.of(new Candidate(name(), p, confidence));
    }
}
