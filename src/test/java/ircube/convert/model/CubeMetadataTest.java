package ircube.convert.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CubeMetadataTest {

    private final CubeMetadata metadata = CubeMetadata.of(Map.of(
            "FPA Pixel Size", 5.5,
            "PixelAggregationSize", "2",
            "Label", "sample A",
            "wavenumbers", new double[]{1000, 1002},
            "list", List.of(1, 2, 3),
            "mixed", List.of(1, "x")));

    @Test
    void testGetDouble() {
        assertEquals(5.5, metadata.getDouble("FPA Pixel Size"));
        assertEquals(2.0, metadata.getDouble("PixelAggregationSize"));
        assertNull(metadata.getDouble("Label"));
        assertNull(metadata.getDouble("missing"));
    }

    @Test
    void testGetDoubleArray() {
        assertArrayEquals(new double[]{1000, 1002}, metadata.getDoubleArray("wavenumbers"));
        assertArrayEquals(new double[]{1, 2, 3}, metadata.getDoubleArray("list"));
        assertNull(metadata.getDoubleArray("mixed"));
        assertNull(metadata.getDoubleArray("Label"));
    }

    @Test
    void testEmpty() {
        assertEquals(0, CubeMetadata.empty().size());
        assertFalse(CubeMetadata.of(null).contains("anything"));
    }
}
