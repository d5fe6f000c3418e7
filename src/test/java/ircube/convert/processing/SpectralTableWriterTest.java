package ircube.convert.processing;

import ircube.convert.TestCubes;
import ircube.convert.model.FlattenedCube;
import ircube.convert.model.MetaTable;
import ircube.convert.model.SpectralCube;
import ircube.convert.model.SpectralTable;
import ircube.convert.model.WavelengthAxis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpectralTableWriterTest {

    @TempDir
    Path tmp;

    private final SpectralTableWriter writer = new SpectralTableWriter();

    private SpectralTable table(SpectralCube cube, WavelengthAxis axis, double pixelSize) {
        FlattenedCube flat = new CubeFlattener().flatten(cube, axis, pixelSize);
        return new TableAssembler().assemble(flat, MetaTable.empty(flat.spectra().getRows()));
    }

    @Test
    @DisplayName("File has exactly one header line and one line per pixel, newline-terminated")
    void testLayout() throws IOException {
        SpectralTable table = table(TestCubes.indexed(2, 2, 3), WavelengthAxis.of(100, 200, 300), 1.0);
        Path out = tmp.resolve("out.csv");

        writer.write(table, "map_x,map_y,100,200,300", out);

        String content = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(content.endsWith("\n"));
        assertFalse(content.contains("\r"));
        assertFalse(content.contains("#"));
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(5, lines.size());
        assertEquals("map_x,map_y,100,200,300", lines.get(0));
        assertEquals("0.00000000,0.00000000,0.00000000,1.00000000,2.00000000", lines.get(1));
        assertEquals("1.00000000,0.00000000,10.00000000,11.00000000,12.00000000", lines.get(2));
        assertEquals("0.00000000,1.00000000,100.00000000,101.00000000,102.00000000", lines.get(3));
        assertEquals("1.00000000,1.00000000,110.00000000,111.00000000,112.00000000", lines.get(4));
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.00000000",
            "1.5, 1.50000000",
            "-2.25, -2.25000000",
            "0.123456789, 0.12345679",
            "1234567.000000004, 1234567.00000000",
            "1e-9, 0.00000000",
            "0.001953125, 0.00195312",
            "0.005859375, 0.00585938"
    })
    void testFormatValue(double value, String expected) {
        assertEquals(expected, writer.formatValue(value));
    }

    @Test
    void testNonFiniteValues() {
        assertEquals("nan", writer.formatValue(Double.NaN));
        assertEquals("inf", writer.formatValue(Double.POSITIVE_INFINITY));
        assertEquals("-inf", writer.formatValue(Double.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("Parsing the written file recovers every value within 1e-8")
    void testRoundTripPrecision() throws IOException {
        float[] data = new float[3 * 2 * 4];
        for (int i = 0; i < data.length; i++) {
            data[i] = (float) (Math.sin(i * 0.37) * 1000.0 / (i + 1));
        }
        SpectralCube cube = new SpectralCube(3, 2, 4, data);
        SpectralTable table = table(cube, WavelengthAxis.of(949.7215, 951.6501, 953.5787, 955.5073), 5.5);
        Path out = tmp.resolve("roundtrip.csv");

        writer.write(table, "header", out);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(table.getRowCount() + 1, lines.size());
        for (int r = 0; r < table.getRowCount(); r++) {
            String[] cells = lines.get(r + 1).split(",");
            assertEquals(table.getColumnCount(), cells.length);
            for (int c = 0; c < cells.length; c++) {
                assertEquals(table.get(r, c), Double.parseDouble(cells[c]), 1e-8,
                        "Cell (" + r + ", " + c + ")");
            }
        }
    }

    @Test
    void testOverwritesExistingFile() throws IOException {
        Path out = tmp.resolve("existing.csv");
        Files.writeString(out, "old content that is much longer than the new table\n".repeat(20));

        writer.write(table(TestCubes.indexed(1, 1, 1), null, 1.0), "map_x,map_y,0", out);

        assertEquals(List.of("map_x,map_y,0", "0.00000000,0.00000000,0.00000000"), Files.readAllLines(out));
    }

    @Test
    @DisplayName("Unwritable destination raises SerializationException")
    void testUnwritableDestination() {
        Path out = tmp.resolve("missing-dir").resolve("out.csv");
        assertThrows(SerializationException.class,
                () -> writer.write(table(TestCubes.indexed(1, 1, 1), null, 1.0), "h", out));
    }

    @Test
    void testCustomFormat() throws IOException {
        SpectralTableWriter custom = new SpectralTableWriter(2, ";");
        Path out = tmp.resolve("custom.csv");
        custom.write(table(TestCubes.indexed(1, 2, 1), null, 0.5), "h", out);
        assertEquals(List.of("h", "0.00;0.00;0.00", "0.50;0.00;10.00"), Files.readAllLines(out));
    }
}
