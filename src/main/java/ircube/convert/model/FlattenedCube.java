package ircube.convert.model;

/**
 * Output of flattening a cube: the spectral axis, one spectrum per pixel and the
 * matching {@code map_x}/{@code map_y} coordinate table. Row {@code i} of
 * {@code coordinates} describes row {@code i} of {@code spectra}.
 */
public record FlattenedCube(WavelengthAxis features, SpectraMatrix spectra, MetaTable coordinates) {

    public FlattenedCube {
        if (spectra.getRows() != coordinates.getRowCount()) {
            throw new IllegalArgumentException(String.format(
                    "Spectra have %d rows but coordinates have %d", spectra.getRows(), coordinates.getRowCount()));
        }
        if (features.size() != spectra.getWidth()) {
            throw new IllegalArgumentException(String.format(
                    "Axis has %d values but spectra have %d samples", features.size(), spectra.getWidth()));
        }
    }
}
