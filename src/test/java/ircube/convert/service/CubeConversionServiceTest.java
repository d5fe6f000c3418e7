package ircube.convert.service;

import ircube.convert.TestCubes;
import ircube.convert.model.CubeData;
import ircube.convert.model.CubeVariant;
import ircube.convert.model.SpectralTable;
import ircube.convert.model.WavelengthAxis;
import ircube.convert.preferences.ConverterSettings;
import ircube.convert.processing.SerializationException;
import ircube.convert.source.CubeParseException;
import ircube.convert.source.CubeSource;
import ircube.convert.source.CubeSourceRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CubeConversionServiceTest {

    @TempDir
    Path tmp;

    private static final Map<String, Object> IFG_METADATA = Map.of(
            "Effective Laser Wavenumber", 15798.0,
            "Under Sampling Ratio", 2);

    private CubeConversionService service(CubeSource source) {
        CubeSourceRegistry registry = new CubeSourceRegistry();
        registry.register(source);
        return new CubeConversionService(registry, ConverterSettings.defaults());
    }

    private static CubeSource mockSource(CubeVariant variant) {
        CubeSource source = mock(CubeSource.class);
        when(source.getVariant()).thenReturn(variant);
        when(source.getExtensions()).thenReturn(List.of(variant.getExtension()));
        return source;
    }

    @Test
    @DisplayName("Single-file conversion writes <input>-converted.csv")
    void testConvertImage() throws IOException {
        Path input = Files.createFile(tmp.resolve("pos0.dat"));
        CubeSource source = mockSource(CubeVariant.IMAGE);
        when(source.read(input)).thenReturn(new CubeData(input, CubeVariant.IMAGE,
                TestCubes.indexed(2, 2, 3), WavelengthAxis.of(100, 200, 300), null));

        Path output = service(source).convert(input);

        assertEquals(tmp.resolve("pos0.dat-converted.csv"), output);
        List<String> lines = Files.readAllLines(output);
        assertEquals("map_x,map_y,100,200,300", lines.get(0));
        assertEquals(5, lines.size());
        assertEquals("0.00000000,1.00000000,100.00000000,101.00000000,102.00000000", lines.get(3));
    }

    @Test
    @DisplayName("Interferogram tables carry the instrument parameters after the coordinates")
    void testBuildTableInterferogram() {
        CubeConversionService service = new CubeConversionService(new CubeSourceRegistry(), ConverterSettings.defaults());
        CubeData data = TestCubes.data(CubeVariant.MOSAIC_IFG, TestCubes.indexed(2, 3, 4), null, IFG_METADATA);

        SpectralTable table = service.buildTable(data);

        assertEquals(6, table.getRowCount());
        assertEquals(2 + 2 + 4, table.getColumnCount());
        assertEquals(List.of("map_x", "map_y", "Effective Laser Wavenumber", "Under Sampling Ratio", "0", "1", "2", "3"),
                table.getColumnNames());
    }

    @Test
    @DisplayName("Non-interferogram variants never get parameter columns")
    void testBuildTableImageIgnoresParameters() {
        CubeConversionService service = new CubeConversionService(new CubeSourceRegistry(), ConverterSettings.defaults());
        CubeData data = TestCubes.data(CubeVariant.IMAGE, TestCubes.indexed(1, 2, 2), null, IFG_METADATA);
        assertEquals(List.of("map_x", "map_y", "0", "1"), service.buildTable(data).getColumnNames());
    }

    @Test
    @DisplayName("Parse failures propagate in single-file mode")
    void testParseFailurePropagates() throws IOException {
        Path input = tmp.resolve("broken.dat");
        CubeSource source = mockSource(CubeVariant.IMAGE);
        when(source.read(any())).thenThrow(new CubeParseException("bad header"));

        CubeConversionService service = service(source);

        assertThrows(CubeParseException.class, () -> service.convert(input));
        assertFalse(Files.exists(tmp.resolve("broken.dat-converted.csv")));
    }

    @Test
    void testUnsupportedExtension() {
        CubeConversionService service = new CubeConversionService(new CubeSourceRegistry(), ConverterSettings.defaults());
        assertThrows(CubeParseException.class, () -> service.convert(tmp.resolve("notes.txt")));
    }

    @Test
    void testSerializationFailurePropagates() throws IOException {
        Path input = tmp.resolve("ok.dat");
        CubeSource source = mockSource(CubeVariant.IMAGE);
        when(source.read(input)).thenReturn(new CubeData(input, CubeVariant.IMAGE, TestCubes.indexed(1, 1, 1), null, null));

        CubeConversionService service = service(source);
        Path output = tmp.resolve("no-such-dir").resolve("out.csv");

        assertThrows(SerializationException.class, () -> service.convert(input, output));
    }
}
