package ircube.convert.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Unified per-pixel table: meta columns followed by one column per spectral sample.
 *
 * <p>Row count is the pixel count N; column count is {@code |meta| + W}. Row {@code i} of
 * the meta columns always pairs with row {@code i} of the spectra.</p>
 */
public final class SpectralTable {

    private final MetaTable meta;
    private final SpectraMatrix spectra;
    private final WavelengthAxis features;

    public SpectralTable(MetaTable meta, SpectraMatrix spectra, WavelengthAxis features) {
        if (meta.getRowCount() != spectra.getRows()) {
            throw new IllegalArgumentException(String.format(
                    "Meta columns have %d rows but spectra have %d", meta.getRowCount(), spectra.getRows()));
        }
        if (features.size() != spectra.getWidth()) {
            throw new IllegalArgumentException(String.format(
                    "Axis has %d values but spectra have %d samples", features.size(), spectra.getWidth()));
        }
        this.meta = meta;
        this.spectra = spectra;
        this.features = features;
    }

    public int getRowCount() {
        return spectra.getRows();
    }

    public int getColumnCount() {
        return meta.getColumnCount() + spectra.getWidth();
    }

    public MetaTable getMeta() {
        return meta;
    }

    public SpectraMatrix getSpectra() {
        return spectra;
    }

    public WavelengthAxis getFeatures() {
        return features;
    }

    public double get(int row, int column) {
        int metaCount = meta.getColumnCount();
        if (column < metaCount) {
            return meta.get(row, column);
        }
        return spectra.get(row, column - metaCount);
    }

    /**
     * Column names in output order: meta column names, then each axis value as a numeral.
     */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(getColumnCount());
        names.addAll(meta.getColumnNames());
        for (int i = 0; i < features.size(); i++) {
            names.add(features.formatValue(i));
        }
        return names;
    }

    @Override
    public String toString() {
        return String.format("SpectralTable[%d rows, %d meta + %d spectral columns]",
                getRowCount(), meta.getColumnCount(), spectra.getWidth());
    }
}
