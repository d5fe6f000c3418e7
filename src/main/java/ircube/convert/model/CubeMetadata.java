package ircube.convert.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instrument metadata dictionary decoded alongside a cube.
 *
 * <p>Values are kept as decoded (numbers, strings, numeric arrays or lists). The typed
 * getters return {@code null} when a key is absent or its value cannot be read as the
 * requested type, so callers can apply their own defaults.</p>
 */
public final class CubeMetadata {

    private static final CubeMetadata EMPTY = new CubeMetadata(Map.of());

    private final Map<String, Object> entries;

    private CubeMetadata(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static CubeMetadata of(Map<String, ?> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        return new CubeMetadata(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public static CubeMetadata empty() {
        return EMPTY;
    }

    public boolean contains(String key) {
        return key != null && entries.containsKey(key);
    }

    public Object get(String key) {
        return key == null ? null : entries.get(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, Object> asMap() {
        return entries;
    }

    /**
     * Reads a scalar numeric value. Strings are parsed; anything else yields null.
     */
    public Double getDouble(String key) {
        Object value = get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Reads a numeric sequence stored as a primitive array or a list of numbers.
     */
    public double[] getDoubleArray(String key) {
        Object value = get(key);
        if (value instanceof double[]) {
            return ((double[]) value).clone();
        }
        if (value instanceof float[]) {
            float[] f = (float[]) value;
            double[] d = new double[f.length];
            for (int i = 0; i < f.length; i++) {
                d[i] = f[i];
            }
            return d;
        }
        if (value instanceof List<?>) {
            List<?> list = (List<?>) value;
            double[] d = new double[list.size()];
            for (int i = 0; i < d.length; i++) {
                Object item = list.get(i);
                if (!(item instanceof Number)) {
                    return null;
                }
                d[i] = ((Number) item).doubleValue();
            }
            return d;
        }
        return null;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "CubeMetadata" + entries.keySet();
    }
}
