package ircube.convert.service;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutputNameGeneratorTest {

    @ParameterizedTest
    @CsvSource({
            "data/pos0_x25.dat, data/pos0_x25.dat-converted.csv",
            "tile.seq, tile.seq-converted.csv",
            "run.1/mosaic.dmt, run.1/mosaic.dmt-converted.csv"
    })
    void testSingleFileOutput(String input, String expected) {
        assertEquals(Path.of(expected), OutputNameGenerator.singleFileOutput(Path.of(input)));
    }

    @ParameterizedTest
    @CsvSource({
            "data/pos0_x25.dat, data/pos0_x25_converted.csv",
            "run.1/mosaic.dmt, run.1/mosaic_converted.csv",
            "a.b.seq, a.b_converted.csv",
            "noext, noext_converted.csv"
    })
    void testBatchOutput(String input, String expected) {
        assertEquals(Path.of(expected), OutputNameGenerator.batchOutput(Path.of(input)));
    }
}
