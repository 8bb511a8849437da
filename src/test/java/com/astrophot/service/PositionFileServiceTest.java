package com.astrophot.service;

import com.astrophot.model.ApertureParams;
import com.astrophot.model.Position;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionFileServiceTest {

    @TempDir
    Path tmp;

    private final PositionFileService service = new PositionFileService();

    @Test
    void savedPositionsLoadBackWithGaps() throws Exception {
        final var file = tmp.resolve("pos.csv");
        final var positions = Arrays.asList(new Position(10.25, 20.5), null, new Position(12, 21.75));

        service.save(file, "Algol", new ApertureParams(8, 11, 16), positions,
                List.of("a.fits", "b.fits", "c.fits"), "tracked");

        final var lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(String.join(",", PositionFileService.COLUMNS));
        assertThat(lines.get(2)).startsWith("2,c.fits,Algol,12.00,21.75,tracked,8.00,11.00,16.00,");

        final var loaded = service.load(file);
        assertThat(loaded.starName).isEqualTo("Algol");
        assertThat(loaded.aperture).isEqualTo(new ApertureParams(8, 11, 16));
        assertThat(loaded.positions).containsExactly(new Position(10.25, 20.5), null, new Position(12, 21.75));
    }

    @Test
    void loadsMinimalFileWithoutIndexColumn() throws Exception {
        final var file = tmp.resolve("min.csv");
        Files.writeString(file, "x_position,y_position\n1.5,2.5\n\n3,4\n");

        final var loaded = service.load(file);

        assertThat(loaded.positions).containsExactly(new Position(1.5, 2.5), new Position(3, 4));
        assertThat(loaded.aperture).isNull();
        assertThat(loaded.starName).isEmpty();
    }

    @Test
    void rejectsFileWithoutCoordinates() throws Exception {
        final var file = tmp.resolve("bad.csv");
        Files.writeString(file, "image_index,filename\n0,a.fits\n");

        assertThatThrownBy(() -> service.load(file)).isInstanceOf(IOException.class)
                .hasMessageContaining("x_position");
    }

    @Test
    void rejectsMalformedNumbers() throws Exception {
        final var file = tmp.resolve("nan.csv");
        Files.writeString(file, "x_position,y_position\n1.0,abc\n");

        assertThatThrownBy(() -> service.load(file)).isInstanceOf(IOException.class)
                .hasMessageContaining("Fila 2");
    }

    @Test
    void namesWithCommasAndQuotesSurviveSaveAndLoad() throws Exception {
        final var file = tmp.resolve("quoted.csv");

        service.save(file, "V \"RR\", Lyr", new ApertureParams(9, 12, 17), List.of(new Position(5, 6)),
                List.of("a,b.fits"), "manual");
        final var loaded = service.load(file);

        assertThat(Files.readAllLines(file).get(1)).startsWith("0,\"a,b.fits\",\"V \"\"RR\"\", Lyr\",5.00,6.00,manual,");
        assertThat(loaded.starName).isEqualTo("V \"RR\", Lyr");
        assertThat(loaded.positions).containsExactly(new Position(5, 6));
    }

    @Test
    void shortRowIsReportedWithItsLineNumber() throws Exception {
        final var file = tmp.resolve("short.csv");
        Files.writeString(file, "image_index,x_position,y_position\n0,1,2\n1,3\n");

        assertThatThrownBy(() -> service.load(file)).isInstanceOf(IOException.class)
                .hasMessageContaining("Fila 3");
    }
}
