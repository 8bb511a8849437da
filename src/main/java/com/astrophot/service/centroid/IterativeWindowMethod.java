package com.astrophot.service.centroid;

import com.astrophot.model.Position;

import java.util.Optional;

/** Re-centra una ventana 7x7 sobre su propio centroide, partiendo del centro del recorte. */
public class IterativeWindowMethod implements CentroidMethod {

    private static final int WINDOW = 7;
    private static final int ITERATIONS = 3;

    @Override
    public String name() { return "iterative-window"; }

    @Override
    public Optional<Candidate> locate(SearchRegion region) {
        double cx = region.width() / 2.0, cy = region.height() / 2.0;

        for (int i = 0; i < ITERATIONS; i++) {
            int x0 = Math.max(0, (int) cx - WINDOW / 2), x1 = Math.min(region.width(), (int) cx + WINDOW / 2 + 1);
            int y0 = Math.max(0, (int) cy - WINDOW / 2), y1 = Math.min(region.height(), (int) cy + WINDOW / 2 + 1);
            if (x1 <= x0 || y1 <= y0) break;

            double sum = 0, sx = 0, sy = 0;
            for (int y = y0; y < y1; y++) {
                for (int x = x0; x < x1; x++) {
                    double v = region.cutout[y][x];
                    sum += v; sx += x * v; sy += y * v;
                }
            }
            if (sum == 0) break;
            cx = sx / sum;
            cy = sy / sum;
        }
        Position p = region.toPlane(cx, cy);
        if (!region.isPlausible(p)) return Optional.empty();
        return Optional.of(new Candidate(name(), p, confidence(region, cx, cy)));
    }

    // Relación pico/umbral en una ventana de 7x7 alrededor del centroide
    static double confidence(SearchRegion region, double cx, double cy) {
        int x0 = Math.max(0, (int) cx - 3), x1 = Math.min(region.width(), (int) cx + 4);
        int y0 = Math.max(0, (int) cy - 3), y1 = Math.min(region.height(), (int) cy + 4);
        double peak = Double.NEGATIVE_INFINITY;
        for (int y = y0; y < y1; y++)
            for (int x = x0; x < x1; x++)
                peak = Math.max(peak, region.cutout[y][x]);
        if (peak == Double.NEGATIVE_INFINITY) return 0.0;
        double c = (peak - region.threshold) / (Math.abs(region.threshold) + 1);
        return Math.max(0.0, Math.min(1.0, c));
    }
}
