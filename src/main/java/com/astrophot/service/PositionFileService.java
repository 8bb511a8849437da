package com.astrophot.service;

import com.astrophot.model.ApertureParams;
import com.astrophot.model.Position;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Guarda y carga las posiciones de la estrella por cuadro, para repetir la fotometría
 * con otra apertura sin volver a marcar la estrella.
 */
public class PositionFileService {

    private static final Logger logger = LoggerFactory.getLogger(PositionFileService.class);

    static final String[] COLUMNS = { "image_index", "filename", "star_name", "x_position", "y_position",
            "position_type", "aperture_inner_radius", "aperture_inner_annulus", "aperture_outer_annulus", "timestamp" };

    public static class LoadedPositions {
        public final String starName;
        public final ApertureParams aperture; // null si el archivo no la trae
        public final List<Position> positions; // índice = cuadro, null = sin posición

        public LoadedPositions(String starName, ApertureParams aperture, List<Position> positions) {
            this.starName = starName;
            this.aperture = aperture;
            this.positions = positions;
        }
    }

    public static String defaultFileName(String starName, int count) {
        return starName.replaceAll("[^A-Za-z0-9._-]", "_") + "_positions_" + count + "frames.csv";
    }

    public void save(Path file, String starName, ApertureParams aperture, List<Position> positions,
                     List<String> frameNames, String positionType) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        String timestamp = LocalDateTime.now().toString();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(COLUMNS).setRecordSeparator('\n').build();
        int written = 0;
        try (CSVPrinter out = new CSVPrinter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), format)) {
            for (int i = 0; i < positions.size(); i++) {
                Position p = positions.get(i);
                if (p == null) continue;
                String name = i < frameNames.size() ? frameNames.get(i) : "frame_" + (i + 1);
                out.printRecord(i, name, starName, fmt(p.x), fmt(p.y), positionType,
                        fmt(aperture.innerRadius), fmt(aperture.innerAnnulus), fmt(aperture.outerAnnulus),
                        timestamp);
                written++;
            }
        }
        logger.info("Posiciones guardadas: {} ({} cuadros)", file, written);
    }

    public LoadedPositions load(Path file) throws IOException {
        List<Position> positions = new ArrayList<>();
        String starName = "";
        ApertureParams aperture = null;

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .build();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser csv = format.parse(in)) {
            if (!csv.getHeaderMap().containsKey("x_position") || !csv.getHeaderMap().containsKey("y_position")) {
                throw new IOException("Faltan columnas x_position/y_position en " + file);
            }

            int row = 0;
            for (CSVRecord r : csv) {
                try {
                    int index = r.isMapped("image_index") ? Integer.parseInt(r.get("image_index")) : row;
                    Position p = new Position(Double.parseDouble(r.get("x_position")),
                            Double.parseDouble(r.get("y_position")));
                    while (positions.size() <= index) positions.add(null);
                    positions.set(index, p);

                    if (starName.isEmpty() && r.isMapped("star_name")) starName = r.get("star_name");
                    if (aperture == null && r.isMapped("aperture_inner_radius")) {
                        aperture = new ApertureParams(
                                Double.parseDouble(r.get("aperture_inner_radius")),
                                Double.parseDouble(r.get("aperture_inner_annulus")),
                                Double.parseDouble(r.get("aperture_outer_annulus")));
                    }
                } catch (IllegalArgumentException e) {
                    // NumberFormatException, o una fila con menos columnas que la cabecera
                    throw new IOException("Fila " + (row + 2) + " inválida en " + file + ": " + String.join(",", r), e);
                }
                row++;
            }
        }
        logger.info("Cargadas {} posiciones de {}", positions.stream().filter(p -> p != null).count(), file);
        return new LoadedPositions(starName, aperture, positions);
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }
}
