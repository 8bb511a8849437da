package com.astrophot.service;

import com.astrophot.model.FrameLoad;
import com.astrophot.model.PixelPlane;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Cuadros FITS de una carpeta, ordenados por nombre. Soporta planos 2-D y cubos RGB [3][h][w].
 */
public class FitsFrameSource implements FrameSource {

    private static final Logger logger = LoggerFactory.getLogger(FitsFrameSource.class);

    private final List<File> files;
    private final FitsHeaderService headerService = new FitsHeaderService();

    public FitsFrameSource(List<File> files) {
        this.files = List.copyOf(files);
    }

    public static FitsFrameSource fromDirectory(File dir) {
        File[] found = dir.listFiles((d, name) -> isFits(name));
        List<File> list = new ArrayList<>(found == null ? List.of() : Arrays.asList(found));
        list.sort(Comparator.comparing(File::getName));
        logger.info("{} cuadros FITS en {}", list.size(), dir.getAbsolutePath());
        return new FitsFrameSource(list);
    }

    static boolean isFits(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        return n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts");
    }

    @Override
    public int frameCount() {
        return files.size();
    }

    @Override
    public String frameName(int index) {
        return files.get(index).getName();
    }

    @Override
    public FrameLoad load(int index) {
        File f = files.get(index);
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            // Algunas cámaras dejan el primario vacío y la imagen en la primera extensión
            if (hdu != null && hdu.getKernel() == null) hdu = fits.getHDU(1);
            if (hdu == null || hdu.getKernel() == null) return FrameLoad.failed("Sin datos de imagen: " + f.getName());

            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);
            PixelPlane plane = toPlane(hdu.getKernel(), bscale, bzero);
            return FrameLoad.loaded(plane, headerService.readMetadata(header, f));
        } catch (Exception e) {
            logger.warn("No se pudo leer {}: {}", f.getName(), e.getMessage());
            return FrameLoad.failed(f.getName() + ": " + e.getMessage());
        }
    }

    static PixelPlane toPlane(Object kernel, double bscale, double bzero) {
        // short[][] -> sus filas son short[]; un cubo short[][][] tiene filas Object[]
        if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
            Object[] cube = (Object[]) kernel;
            if (cube.length != 3) throw new IllegalArgumentException("Cubo con " + cube.length + " planos, se esperaban 3");
            double[][][] ch = new double[3][][];
            for (int i = 0; i < 3; i++) ch[i] = toDouble(cube[i], bscale, bzero);
            return PixelPlane.rgb(ch);
        }
        return PixelPlane.gray(toDouble(kernel, bscale, bzero));
    }

    static double[][] toDouble(Object k, double bscale, double bzero) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bscale * s[i][j] + bzero;
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = bscale * f[i][j] + bzero;
            return d;
        }
        if (k instanceof int[][]) {
            int[][] n = (int[][]) k;
            double[][] d = new double[n.length][n[0].length];
            for (int i = 0; i < n.length; i++) for (int j = 0; j < n[0].length; j++) d[i][j] = bscale * n[i][j] + bzero;
            return d;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bscale * s[i][j] + bzero;
            return d;
        }
        if (k instanceof byte[][]) {
            // BITPIX 8 es sin signo
            byte[][] b = (byte[][]) k;
            double[][] d = new double[b.length][b[0].length];
            for (int i = 0; i < b.length; i++) for (int j = 0; j < b[0].length; j++) d[i][j] = bscale * (b[i][j] & 0xFF) + bzero;
            return d;
        }
        throw new IllegalArgumentException("Tipo de datos FITS no soportado: " + (k == null ? "null" : k.getClass().getSimpleName()));
    }
}
