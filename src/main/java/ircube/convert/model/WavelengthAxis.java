package ircube.convert.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered spectral axis (usually wavenumbers) with one value per spectral sample.
 */
public final class WavelengthAxis {

    private final double[] values;

    private WavelengthAxis(double[] values) {
        this.values = values;
    }

    public static WavelengthAxis of(double... values) {
        if (values == null) {
            throw new IllegalArgumentException("Axis values must not be null");
        }
        return new WavelengthAxis(values.clone());
    }

    public static WavelengthAxis of(List<? extends Number> values) {
        if (values == null) {
            throw new IllegalArgumentException("Axis values must not be null");
        }
        double[] arr = new double[values.size()];
        for (int i = 0; i < arr.length; i++) {
            arr[i] = values.get(i).doubleValue();
        }
        return new WavelengthAxis(arr);
    }

    /**
     * Axis used when nothing is known about the spectral dimension: 0, 1, ..., size-1.
     */
    public static WavelengthAxis defaultAxis(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Axis size must not be negative: " + size);
        }
        double[] arr = new double[size];
        for (int i = 0; i < size; i++) {
            arr[i] = i;
        }
        return new WavelengthAxis(arr);
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Formats one axis value as a plain numeral for a column header.
     * Integral values drop the fraction ({@code 100}), others keep the shortest
     * decimal that round-trips ({@code 1000.5}). Never uses exponent notation.
     */
    public String formatValue(int index) {
        double v = values[index];
        if (Double.isNaN(v)) {
            return "nan";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "inf" : "-inf";
        }
        String plain = BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
        return "-0".equals(plain) ? "0" : plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WavelengthAxis)) return false;
        return Arrays.equals(values, ((WavelengthAxis) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        if (values.length == 0) {
            return "WavelengthAxis[]";
        }
        return String.format("WavelengthAxis[%d values, %s .. %s]",
                values.length, formatValue(0), formatValue(values.length - 1));
    }
}
