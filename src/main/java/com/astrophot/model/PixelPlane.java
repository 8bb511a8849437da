package com.astrophot.model;

import java.util.List;

/**
 * Plano de pixeles ya decodificado, indexado [y][x]. Gris (1 canal) o RGB (3 canales).
 * El núcleo nunca modifica los arrays recibidos.
 */
public final class PixelPlane {

    public enum Channel { GRAY, R, G, B, L }

    private final double[][][] channels;
    private final int width;
    private final int height;
    private double[][] luminance;

    private PixelPlane(double[][][] channels) {
        if (channels.length == 0 || channels[0].length == 0 || channels[0][0].length == 0) {
            throw new IllegalArgumentException("Plano vacío");
        }
        this.height = channels[0].length;
        this.width = channels[0][0].length;
        for (double[][] c : channels) {
            if (c.length != height || c[0].length != width) {
                throw new IllegalArgumentException("Los canales RGB deben tener la misma forma");
            }
        }
        this.channels = channels;
    }

    public static PixelPlane gray(double[][] data) {
        return new PixelPlane(new double[][][] { data });
    }

    public static PixelPlane rgb(double[][] r, double[][] g, double[][] b) {
        return new PixelPlane(new double[][][] { r, g, b });
    }

    /** Cubo [3][h][w] con eje de canal al frente. */
    public static PixelPlane rgb(double[][][] cube) {
        if (cube.length != 3) throw new IllegalArgumentException("Se esperaban 3 canales, hay " + cube.length);
        return rgb(cube[0], cube[1], cube[2]);
    }

    public boolean isRgb() {
        return channels.length == 3;
    }

    public int width() { return width; }
    public int height() { return height; }

    public List<Channel> channelNames() {
        return isRgb() ? List.of(Channel.R, Channel.G, Channel.B, Channel.L) : List.of(Channel.GRAY);
    }

    public double[][] channel(Channel c) {
        switch (c) {
            case GRAY: return tracking();
            case R: return rgbChannel(0);
            case G: return rgbChannel(1);
            case B: return rgbChannel(2);
            case L: return isRgb() ? luminance() : channels[0];
            default: throw new IllegalArgumentException(c.name());
        }
    }

    /** Plano usado para el seguimiento: el gris, o la media R,G,B. */
    public double[][] tracking() {
        return isRgb() ? luminance() : channels[0];
    }

    private double[][] rgbChannel(int i) {
        if (!isRgb()) throw new IllegalArgumentException("El plano no es RGB");
        return channels[i];
    }

    private synchronized double[][] luminance() {
        if (luminance == null) {
            double[][] l = new double[height][width];
            for (int y = 0; y < height; y++)
                for (int x = 0; x < width; x++)
                    l[y][x] = (channels[0][y][x] + channels[1][y][x] + channels[2][y][x]) / 3.0;
            luminance = l;
        }
        return luminance;
    }
}
