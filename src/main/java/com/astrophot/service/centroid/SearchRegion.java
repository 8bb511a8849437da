package com.astrophot.service.centroid;

import com.astrophot.model.Position;
import com.astrophot.service.SigmaClippedStats;

/**
 * Recorte cuadrado alrededor del centro de búsqueda, con su umbral adaptativo.
 * Coordenadas del recorte: (0,0) corresponde a (xMin, yMin) del plano.
 */
public final class SearchRegion {

    static final int EDGE_MARGIN = 5;
    static final double ACCEPT_FACTOR = 1.5;

    public final double[][] cutout;
    public final int xMin, yMin;
    public final int planeWidth, planeHeight;
    public final Position expected;
    public final Position searchCenter;
    public final double radius;
    public final double median;
    public final double std;
    public final double peak;
    public final double threshold;

    private SearchRegion(double[][] cutout, int xMin, int yMin, int planeWidth, int planeHeight,
                         Position expected, Position searchCenter, double radius, SigmaClippedStats stats, double peak) {
        this.cutout = cutout;
        this.xMin = xMin;
        this.yMin = yMin;
        this.planeWidth = planeWidth;
        this.planeHeight = planeHeight;
        this.expected = expected;
        this.searchCenter = searchCenter;
        this.radius = radius;
        this.median = stats.median;
        this.std = stats.std;
        this.peak = peak;
        this.threshold = stats.median + thresholdMultiplier(peak, stats.median, stats.std) * stats.std;
    }

    /** Devuelve null si el recorte queda vacío (centro fuera del plano). */
    public static SearchRegion extract(double[][] plane, Position expected, Position searchCenter, double radius) {
        int h = plane.length;
        int w = plane[0].length;
        int xi = (int) searchCenter.x;
        int yi = (int) searchCenter.y;
        int half = (int) radius;

        int x0 = Math.max(0, xi - half), x1 = Math.min(w, xi + half);
        int y0 = Math.max(0, yi - half), y1 = Math.min(h, yi + half);
        if (x1 <= x0 || y1 <= y0) return null;

        double[][] cut = new double[y1 - y0][x1 - x0];
        double peak = Double.NEGATIVE_INFINITY;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                double v = plane[y][x];
                cut[y - y0][x - x0] = v;
                if (v > peak) peak = v;
            }
        }
        return new SearchRegion(cut, x0, y0, w, h, expected, searchCenter, radius, SigmaClippedStats.of(cut), peak);
    }

    // Estrellas brillantes toleran un umbral más bajo
    static double thresholdMultiplier(double peak, double median, double std) {
        double ratio = (peak - median) / (std + 1e-6);
        if (ratio > 10) return 2.0;
        if (ratio > 5) return 2.5;
        return 3.0;
    }

    public int width() { return cutout[0].length; }
    public int height() { return cutout.length; }

    public Position toPlane(double cx, double cy) {
        return new Position(cx + xMin, cy + yMin);
    }

    /** Dentro de 1.5 radios de la posición esperada y a más de 5 px de los bordes del plano. */
    public boolean isPlausible(Position p) {
        if (!Double.isFinite(p.x) || !Double.isFinite(p.y)) return false;
        return p.distanceTo(expected) <= radius * ACCEPT_FACTOR
                && p.x > EDGE_MARGIN && p.x < planeWidth - EDGE_MARGIN
                && p.y > EDGE_MARGIN && p.y < planeHeight - EDGE_MARGIN;
    }

    /**
     * Centroide ponderado por max(v - umbral, 0)^power dentro de la ventana [x0,x1) x [y0,y1) del recorte.
     * Devuelve null si no hay masa.
     */
    double[] weightedCentroid(int x0, int y0, int x1, int y1, double power) {
        double sum = 0, sx = 0, sy = 0;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                double w = cutout[y][x] - threshold;
                if (w <= 0) continue;
                if (power != 1.0) w = Math.pow(w, power);
                sum += w;
                sx += x * w;
                sy += y * w;
            }
        }
        if (sum <= 0) return null;
        return new double[] { sx / sum, sy / sum };
    }
}
