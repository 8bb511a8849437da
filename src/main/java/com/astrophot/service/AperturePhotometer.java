package com.astrophot.service;

import com.astrophot.model.ApertureParams;
import com.astrophot.model.ChannelMeasurement;
import com.astrophot.model.PixelPlane;
import com.astrophot.model.Position;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fotometría de apertura: flujo en el disco, fondo de cielo por mediana con recorte sigma
 * en el anillo, flujo corregido y ruido de Poisson.
 */
public class AperturePhotometer {

    // Submuestreo por eje para pixeles cortados por el borde del disco
    private static final int SUBSAMPLES = 5;

    public List<ChannelMeasurement> measure(PixelPlane plane, Position position, ApertureParams params) {
        List<ChannelMeasurement> out = new ArrayList<>();
        for (PixelPlane.Channel c : plane.channelNames()) {
            out.add(measureChannel(c, plane.channel(c), position, params));
        }
        return out;
    }

    public ChannelMeasurement measureChannel(PixelPlane.Channel channel, double[][] data, Position position,
                                             ApertureParams params) {
        double raw = apertureSum(data, position, params.innerRadius);
        double area = params.apertureArea();

        double skyMedian = 0, skyStd = 0, background = 0;
        int annulusCount = 0;
        if (params.isSkySubtractionEnabled()) {
            double[] sky = annulusPixels(data, position, params.innerAnnulus, params.outerAnnulus);
            SigmaClippedStats stats = SigmaClippedStats.of(sky);
            skyMedian = stats.median;
            skyStd = stats.std;
            annulusCount = sky.length;
            background = skyMedian * area;
        }
        double corrected = raw - background;
        double poisson = Math.sqrt(Math.max(raw, 0));

        return new ChannelMeasurement(channel, raw, skyMedian, skyStd, background, corrected, poisson, area, annulusCount);
    }

    /** Suma dentro del disco, ponderando cada pixel por la fracción cubierta. */
    static double apertureSum(double[][] data, Position c, double r) {
        int h = data.length, w = data[0].length;
        int x0 = Math.max(0, (int) Math.floor(c.x - r - 1)), x1 = Math.min(w - 1, (int) Math.ceil(c.x + r + 1));
        int y0 = Math.max(0, (int) Math.floor(c.y - r - 1)), y1 = Math.min(h - 1, (int) Math.ceil(c.y + r + 1));

        double sum = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double f = coverage(x, y, c, r);
                if (f > 0) sum += f * data[y][x];
            }
        }
        return sum;
    }

    // Fracción del pixel (centro en x,y, lado 1) dentro del disco
    static double coverage(int x, int y, Position c, double r) {
        double dx = Math.abs(x - c.x), dy = Math.abs(y - c.y);
        double near = Math.hypot(Math.max(dx - 0.5, 0), Math.max(dy - 0.5, 0));
        if (near >= r) return 0.0;
        double far = Math.hypot(dx + 0.5, dy + 0.5);
        if (far <= r) return 1.0;

        int inside = 0;
        double r2 = r * r;
        for (int j = 0; j < SUBSAMPLES; j++) {
            double sy = y - 0.5 + (j + 0.5) / SUBSAMPLES - c.y;
            for (int i = 0; i < SUBSAMPLES; i++) {
                double sx = x - 0.5 + (i + 0.5) / SUBSAMPLES - c.x;
                if (sx * sx + sy * sy <= r2) inside++;
            }
        }
        return inside / (double) (SUBSAMPLES * SUBSAMPLES);
    }

    /** Pixeles cuyo centro cae en el anillo [rIn, rOut]. */
    static double[] annulusPixels(double[][] data, Position c, double rIn, double rOut) {
        int h = data.length, w = data[0].length;
        int x0 = Math.max(0, (int) Math.floor(c.x - rOut)), x1 = Math.min(w - 1, (int) Math.ceil(c.x + rOut));
        int y0 = Math.max(0, (int) Math.floor(c.y - rOut)), y1 = Math.min(h - 1, (int) Math.ceil(c.y + rOut));

        double[] buf = new double[Math.max(0, (x1 - x0 + 1) * (y1 - y0 + 1))];
        int n = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double d = Math.hypot(x - c.x, y - c.y);
                if (d >= rIn && d <= rOut) buf[n++] = data[y][x];
            }
        }
        return Arrays.copyOf(buf, n);
    }
}
