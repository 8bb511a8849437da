package com.astrophot.service;

import com.astrophot.model.ChannelMeasurement;
import com.astrophot.model.PhotometryResult;
import com.astrophot.model.PixelPlane;
import com.astrophot.model.SessionReport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/** Escribe los resultados de la sesión como CSV, una fila por cuadro medido. */
public class CsvResultSink implements ResultSink {

    private static final Logger logger = LoggerFactory.getLogger(CsvResultSink.class);

    private static final String[] CHANNEL_FIELDS = {
            "star_flux_raw", "sky_per_pixel", "sky_std", "sky_background_total", "flux_corrected", "poisson_noise" };

    private final Path file;

    public CsvResultSink(Path file) {
        this.file = file;
    }

    public static String defaultFileName(String starName, int count) {
        return starName.replaceAll("[^A-Za-z0-9._-]", "_") + "_photometry_" + count + "images.csv";
    }

    @Override
    public void accept(SessionReport report) throws IOException {
        List<PhotometryResult> results = report.results;
        Set<PixelPlane.Channel> channels = EnumSet.noneOf(PixelPlane.Channel.class);
        Set<String> metaKeys = new TreeSet<>();
        for (PhotometryResult r : results) {
            r.channels.forEach(m -> channels.add(m.channel));
            metaKeys.addAll(r.metadata.keySet());
        }

        List<String> header = new ArrayList<>(List.of("image_index", "filename", "star_name",
                "x_position", "y_position", "movement_pixels", "is_rgb"));
        for (PixelPlane.Channel c : channels)
            for (String f : CHANNEL_FIELDS) header.add(prefix(c) + f);
        header.addAll(List.of("aperture_area", "sky_annulus_pixels",
                "aperture_inner_radius", "aperture_inner_annulus", "aperture_outer_annulus"));
        header.addAll(metaKeys);

        if (file.getParent() != null) Files.createDirectories(file.getParent());
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .setRecordSeparator('\n')
                .build();
        try (CSVPrinter out = new CSVPrinter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), format)) {
            for (PhotometryResult r : results) {
                List<Object> row = new ArrayList<>();
                row.add(r.frameIndex);
                row.add(r.fileName);
                row.add(r.starName);
                row.add(num(r.position.x));
                row.add(num(r.position.y));
                row.add(num(r.movement));
                row.add(r.rgb);
                for (PixelPlane.Channel c : channels) {
                    ChannelMeasurement m = find(r, c);
                    if (m == null) {
                        for (int i = 0; i < CHANNEL_FIELDS.length; i++) row.add(null);
                    } else {
                        row.add(num(m.rawFlux));
                        row.add(num(m.skyMedian));
                        row.add(num(m.skyStd));
                        row.add(num(m.skyBackgroundTotal));
                        row.add(num(m.correctedFlux));
                        row.add(num(m.poissonNoise));
                    }
                }
                ChannelMeasurement first = r.channels.get(0);
                row.add(num(first.apertureArea));
                row.add(first.annulusPixelCount);
                row.add(num(r.aperture.innerRadius));
                row.add(num(r.aperture.innerAnnulus));
                row.add(num(r.aperture.outerAnnulus));
                for (String k : metaKeys) row.add(r.metadata.get(k));
                out.printRecord(row);
            }
        }
        logger.info("CSV guardado: {} ({} filas)", file, results.size());
    }

    private static ChannelMeasurement find(PhotometryResult r, PixelPlane.Channel c) {
        for (ChannelMeasurement m : r.channels) if (m.channel == c) return m;
        return null;
    }

    static String prefix(PixelPlane.Channel c) {
        return c.name().toLowerCase(Locale.ROOT) + "_";
    }

    static String num(double v) {
        return String.format(Locale.US, "%.6f", v);
    }
}
