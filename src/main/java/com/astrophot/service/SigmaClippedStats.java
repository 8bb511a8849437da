package com.astrophot.service;

import java.util.Arrays;

/**
 * Estadística robusta con recorte sigma iterativo (centro = mediana, desviación poblacional).
 */
public final class SigmaClippedStats {

    public static final double DEFAULT_SIGMA = 3.0;
    public static final int DEFAULT_MAX_ITERS = 10;

    public final double mean;
    public final double median;
    public final double std;
    public final int count;

    private SigmaClippedStats(double mean, double median, double std, int count) {
        this.mean = mean;
        this.median = median;
        this.std = std;
        this.count = count;
    }

    public static SigmaClippedStats of(double[] values) {
        return of(values, DEFAULT_SIGMA, DEFAULT_MAX_ITERS);
    }

    public static SigmaClippedStats of(double[][] data) {
        int n = 0;
        for (double[] row : data) n += row.length;
        double[] flat = new double[n];
        int k = 0;
        for (double[] row : data) {
            System.arraycopy(row, 0, flat, k, row.length);
            k += row.length;
        }
        return of(flat);
    }

    public static SigmaClippedStats of(double[] values, double sigma, int maxIters) {
        double[] kept = Arrays.stream(values).filter(Double::isFinite).sorted().toArray();
        if (kept.length == 0) return new SigmaClippedStats(0, 0, 0, 0);

        for (int iter = 0; iter < maxIters; iter++) {
            double med = median(kept);
            double sd = std(kept, mean(kept));
            double lo = med - sigma * sd;
            double hi = med + sigma * sd;
            // kept ya está ordenado: basta con recortar los extremos
            int from = 0, to = kept.length;
            while (from < to && kept[from] < lo) from++;
            while (to > from && kept[to - 1] > hi) to--;
            if (from == 0 && to == kept.length) break;
            if (from >= to) break;
            kept = Arrays.copyOfRange(kept, from, to);
        }
        double m = mean(kept);
        return new SigmaClippedStats(m, median(kept), std(kept, m), kept.length);
    }

    public static double median(double[] sorted) {
        int n = sorted.length;
        if (n == 0) return 0;
        int mid = n / 2;
        return (n % 2 == 0) ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    public static double mean(double[] v) {
        double s = 0;
        for (double d : v) s += d;
        return v.length == 0 ? 0 : s / v.length;
    }

    public static double std(double[] v, double mean) {
        if (v.length == 0) return 0;
        double s = 0;
        for (double d : v) s += (d - mean) * (d - mean);
        return Math.sqrt(s / v.length);
    }
}
