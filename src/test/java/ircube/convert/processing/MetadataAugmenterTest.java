package ircube.convert.processing;

import ircube.convert.model.CubeMetadata;
import ircube.convert.model.MetaTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataAugmenterTest {

    private static final List<String> KEYS = List.of("Effective Laser Wavenumber", "Under Sampling Ratio");

    private final MetadataAugmenter augmenter = new MetadataAugmenter(KEYS);

    @Test
    @DisplayName("Present parameters become constant columns in key order")
    void testAllPresent() {
        CubeMetadata metadata = CubeMetadata.of(Map.of(
                "Under Sampling Ratio", 2,
                "Effective Laser Wavenumber", 15798.0));

        MetaTable columns = augmenter.augment(metadata, 4);

        assertEquals(KEYS, columns.getColumnNames());
        assertEquals(4, columns.getRowCount());
        for (int r = 0; r < 4; r++) {
            assertEquals(15798.0, columns.get(r, 0));
            assertEquals(2.0, columns.get(r, 1));
        }
    }

    @Test
    @DisplayName("Absent parameters are skipped without placeholder columns")
    void testSomeAbsent() {
        MetaTable columns = augmenter.augment(CubeMetadata.of(Map.of("Under Sampling Ratio", 4)), 3);
        assertEquals(List.of("Under Sampling Ratio"), columns.getColumnNames());

        MetaTable none = augmenter.augment(CubeMetadata.empty(), 3);
        assertEquals(0, none.getColumnCount());
        assertEquals(3, none.getRowCount());
    }

    @Test
    void testNonNumericValueSkipped() {
        MetaTable columns = augmenter.augment(CubeMetadata.of(Map.of(
                "Effective Laser Wavenumber", "unknown",
                "Under Sampling Ratio", "2")), 2);
        assertEquals(List.of("Under Sampling Ratio"), columns.getColumnNames());
        assertEquals(2.0, columns.get(1, 0));
    }
}
