package ircube.convert.model;

/**
 * (N, W) matrix with one spectrum per row, backed by a row-major float buffer.
 */
public final class SpectraMatrix {

    private final int rows;
    private final int width;
    private final float[] data;

    /**
     * Wraps {@code data} without copying.
     *
     * @throws IllegalArgumentException if {@code data.length != rows * width}
     */
    public SpectraMatrix(int rows, int width, float[] data) {
        if (rows < 0 || width < 0) {
            throw new IllegalArgumentException("Matrix dimensions must not be negative");
        }
        if (data == null || (long) rows * width != data.length) {
            throw new IllegalArgumentException(String.format(
                    "Buffer of length %s does not match shape (%d, %d)",
                    data == null ? "null" : String.valueOf(data.length), rows, width));
        }
        this.rows = rows;
        this.width = width;
        this.data = data;
    }

    public int getRows() {
        return rows;
    }

    public int getWidth() {
        return width;
    }

    public float get(int row, int sample) {
        if (row < 0 || row >= rows || sample < 0 || sample >= width) {
            throw new IndexOutOfBoundsException(String.format(
                    "(%d, %d) outside matrix of shape (%d, %d)", row, sample, rows, width));
        }
        return data[row * width + sample];
    }

    /** Copy of one spectrum. */
    public float[] getRow(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("Row " + row + " outside matrix with " + rows + " rows");
        }
        float[] out = new float[width];
        System.arraycopy(data, row * width, out, 0, width);
        return out;
    }

    @Override
    public String toString() {
        return String.format("SpectraMatrix[%d x %d]", rows, width);
    }
}
