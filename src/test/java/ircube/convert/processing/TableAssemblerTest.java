package ircube.convert.processing;

import ircube.convert.TestCubes;
import ircube.convert.model.CubeMetadata;
import ircube.convert.model.FlattenedCube;
import ircube.convert.model.MetaColumn;
import ircube.convert.model.MetaTable;
import ircube.convert.model.SpectralTable;
import ircube.convert.model.WavelengthAxis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableAssemblerTest {

    private final CubeFlattener flattener = new CubeFlattener();
    private final TableAssembler assembler = new TableAssembler();

    @Test
    @DisplayName("Header lists coordinates then wavelengths for plain images")
    void testHeaderWithoutAugmentation() {
        FlattenedCube flat = flattener.flatten(TestCubes.indexed(2, 2, 3), WavelengthAxis.of(100, 200, 300), 1.0);
        SpectralTable table = assembler.assemble(flat, MetaTable.empty(4));

        assertEquals("map_x,map_y,100,200,300", assembler.buildHeader(table));
        assertEquals(4, table.getRowCount());
        assertEquals(5, table.getColumnCount());
    }

    @Test
    @DisplayName("Augmented parameters sit between coordinates and spectra")
    void testColumnOrderWithAugmentation() {
        FlattenedCube flat = flattener.flatten(TestCubes.indexed(1, 2, 2), null, null);
        MetadataAugmenter augmenter = new MetadataAugmenter(List.of("Effective Laser Wavenumber", "Under Sampling Ratio"));
        MetaTable extra = augmenter.augment(CubeMetadata.of(Map.of(
                "Effective Laser Wavenumber", 15798.0, "Under Sampling Ratio", 2)), 2);

        SpectralTable table = assembler.assemble(flat, extra);

        assertEquals("map_x,map_y,Effective Laser Wavenumber,Under Sampling Ratio,0,1",
                assembler.buildHeader(table));
        assertEquals(2 + 2 + 2, table.getColumnCount());
        // row 1 = pixel (0, 1)
        assertEquals(1.0, table.get(1, 0));
        assertEquals(0.0, table.get(1, 1));
        assertEquals(15798.0, table.get(1, 2));
        assertEquals(2.0, table.get(1, 3));
        assertEquals(10.0, table.get(1, 4));
        assertEquals(11.0, table.get(1, 5));
    }

    @Test
    void testNullAugmentationTreatedAsNone() {
        FlattenedCube flat = flattener.flatten(TestCubes.indexed(1, 1, 2), null, null);
        assertEquals(4, assembler.assemble(flat, null).getColumnCount());
    }

    @Test
    void testRowCountMismatchRejected() {
        FlattenedCube flat = flattener.flatten(TestCubes.indexed(2, 2, 1), null, null);
        MetaTable wrong = MetaTable.of(3, List.of(MetaColumn.constant("p", 1, 3)));
        assertThrows(IllegalArgumentException.class, () -> assembler.assemble(flat, wrong));
    }

    @Test
    void testCustomDelimiter() {
        FlattenedCube flat = flattener.flatten(TestCubes.indexed(1, 1, 2), WavelengthAxis.of(1000.5, 1002), null);
        SpectralTable table = assembler.assemble(flat, MetaTable.empty(1));
        assertEquals("map_x;map_y;1000.5;1002", assembler.buildHeader(table, ";"));
    }
}
