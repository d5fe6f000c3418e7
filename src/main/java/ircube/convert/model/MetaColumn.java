package ircube.convert.model;

import java.util.Arrays;

/**
 * Named non-spectral column attached per pixel: a coordinate or a broadcast
 * instrument parameter.
 */
public record MetaColumn(String name, double[] values) {

    public MetaColumn {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
        if (values == null) {
            throw new IllegalArgumentException("Column '" + name + "' has no values");
        }
    }

    /** Column of {@code rows} copies of {@code value}. */
    public static MetaColumn constant(String name, double value, int rows) {
        double[] values = new double[rows];
        Arrays.fill(values, value);
        return new MetaColumn(name, values);
    }

    public int size() {
        return values.length;
    }

    public double get(int row) {
        return values[row];
    }

    @Override
    public String toString() {
        return "MetaColumn[" + name + ", " + values.length + " rows]";
    }
}
