package com.astrophot.service.centroid;

import com.astrophot.model.Position;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Aísla la componente conexa sobre el umbral más cercana al centro de búsqueda
 * (ParticleAnalyzer de ImageJ) y toma su centro de masa.
 */
public class ConnectedComponentMethod implements CentroidMethod {

    private static final Logger logger = LoggerFactory.getLogger(ConnectedComponentMethod.class);

    private static final int MIN_SIZE = 4;
    private static final int MAX_SIZE = 500;
    private static final double DISTANCE_SCALE = 20.0;

    @Override
    public String name() { return "connected-component"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        int w = region.width(), h = region.height();
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();
        float max = Float.NEGATIVE_INFINITY;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                px[y * w + x] = (float) region.cutout[y][x];
                max = Math.max(max, px[y * w + x]);
            }
        }
        float lower = (float) Math.nextUp(region.threshold);
        if (max < lower) return Optional.empty();
        ip.setThreshold(lower, max, FloatProcessor.NO_LUT_UPDATE);

        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE,
                Measurements.CENTER_OF_MASS | Measurements.AREA, rt, MIN_SIZE, MAX_SIZE);
        if (!pa.analyze(new ImagePlus("", ip))) {
            logger.debug("ParticleAnalyzer no pudo analizar el recorte");
            return Optional.empty();
        }
        if (rt.getCounter() == 0) return Optional.empty();

        // ImageJ ubica el centro del pixel en +0.5
        Position center = region.searchCenter;
        double bestDist = Double.MAX_VALUE;
        com.astrophot.model.Position best = null;
        for (int i = 0; i < rt.getCounter(); i++) {
            Position p = region.toPlane(rt.getValue("XM", i) - 0.5, rt.getValue("YM", i) - 0.5);
            double d = p.distanceTo(center);
            if (d < bestDist) { bestDist = d; best = p; }
        }
        if (best == null || !region.isPlausible(best)) return Optional.empty();

        double confidence = Math.max(0.0, 1.0 - bestDist / DISTANCE_SCALE);
        return Optional.of(new Candidate(name(), best, confidence));
    }
}
