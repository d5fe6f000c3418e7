package ircube.convert.model;

/**
 * Raw 3-dimensional spectral cube indexed by (row, column, spectral sample).
 *
 * <p>Values are stored in a single float buffer in row-major order with the spectral
 * index varying fastest, i.e. the value at {@code (r, c, w)} lives at
 * {@code (r * columns + c) * bands + w}. This is the layout FPA readers produce once a
 * tile has been decoded, and it lets the flattened spectra matrix share the buffer.</p>
 *
 * <p>Instances are read-only for the duration of a conversion. The buffer returned by
 * {@link #rawData()} is shared, not copied, and must not be modified.</p>
 *
 * @since 0.1.0
 */
public final class SpectralCube {

    private final int rows;
    private final int columns;
    private final int bands;
    private final float[] data;

    /**
     * Wraps an existing buffer.
     *
     * @param rows spatial row count (R)
     * @param columns spatial column count (C)
     * @param bands number of spectral samples (W)
     * @param data buffer of length R*C*W in (row, column, sample) order
     * @throws IllegalArgumentException if a dimension is not positive or the buffer length does not match
     */
    public SpectralCube(int rows, int columns, int bands, float[] data) {
        if (rows <= 0 || columns <= 0 || bands <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Cube dimensions must be positive, got (%d, %d, %d)", rows, columns, bands));
        }
        if (data == null) {
            throw new IllegalArgumentException("Cube data must not be null");
        }
        long expected = (long) rows * columns * bands;
        if (expected > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Cube is too large for a single buffer: " + expected + " values");
        }
        if (data.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Cube data length %d does not match shape (%d, %d, %d)", data.length, rows, columns, bands));
        }
        this.rows = rows;
        this.columns = columns;
        this.bands = bands;
        this.data = data;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getBands() {
        return bands;
    }

    /** Number of spatial pixels, R*C. */
    public int getPixelCount() {
        return rows * columns;
    }

    public float get(int row, int column, int band) {
        if (row < 0 || row >= rows || column < 0 || column >= columns || band < 0 || band >= bands) {
            throw new IndexOutOfBoundsException(String.format(
                    "(%d, %d, %d) outside cube of shape (%d, %d, %d)", row, column, band, rows, columns, bands));
        }
        return data[(row * columns + column) * bands + band];
    }

    /**
     * Shared backing buffer. Callers must treat it as read-only.
     */
    public float[] rawData() {
        return data;
    }

    @Override
    public String toString() {
        return String.format("SpectralCube[%d x %d x %d]", rows, columns, bands);
    }
}
