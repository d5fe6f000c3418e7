package ircube.convert.processing;

import ircube.convert.model.FlattenedCube;
import ircube.convert.model.MetaTable;
import ircube.convert.model.SpectralTable;

/**
 * Joins coordinates, augmented parameter columns and spectra into one table.
 *
 * <p>Column order is fixed: {@code map_x}, {@code map_y}, augmented parameters in their
 * source order, then one column per spectral sample.</p>
 */
public class TableAssembler {

    /**
     * @param flattened coordinates and spectra from {@link CubeFlattener}
     * @param augmented extra per-pixel columns, possibly empty
     * @throws IllegalArgumentException if the augmented columns have a different row count
     */
    public SpectralTable assemble(FlattenedCube flattened, MetaTable augmented) {
        MetaTable meta = augmented == null
                ? flattened.coordinates()
                : flattened.coordinates().concat(augmented);
        return new SpectralTable(meta, flattened.spectra(), flattened.features());
    }

    /**
     * Header line naming every column of {@code table}, joined with {@code delimiter}.
     */
    public String buildHeader(SpectralTable table, String delimiter) {
        return String.join(delimiter, table.getColumnNames());
    }

    public String buildHeader(SpectralTable table) {
        return buildHeader(table, ",");
    }
}
