package ircube.convert.preferences;

import ircube.convert.processing.CubeFlattener;
import ircube.convert.source.CubeSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * ConverterSettings
 *
 * <p>Immutable converter configuration backed by YAML:
 *   - Defaults come from the classpath resource {@code ircube-convert.yml}.
 *   - A user file can overlay any subset of keys ({@link #load(Path)}).
 *   - Missing keys keep their defaults; malformed values are logged and ignored.
 *   - Extensions are normalized ({@code "SEQ"} becomes {@code ".seq"}).
 *
 * <pre>{@code
 * format:
 *   decimals: 8
 *   delimiter: ","
 * metadata:
 *   import_params: ["Effective Laser Wavenumber", "Under Sampling Ratio"]
 *   pixel_size_key: "FPA Pixel Size"
 *   aggregation_key: "PixelAggregationSize"
 *   wavenumbers_key: "wavenumbers"
 * batch:
 *   extensions: []          # empty = every extension with a registered reader
 *   write_report: true
 *   log_to_directory: true
 * }</pre>
 */
public final class ConverterSettings {

    private static final Logger logger = LoggerFactory.getLogger(ConverterSettings.class);

    static final String DEFAULTS_RESOURCE = "/ircube-convert.yml";

    private static final List<String> RESERVED_COLUMNS = List.of(CubeFlattener.MAP_X, CubeFlattener.MAP_Y);

    private final int decimals;
    private final String delimiter;
    private final List<String> importParams;
    private final String pixelSizeKey;
    private final String aggregationKey;
    private final String wavenumbersKey;
    private final List<String> batchExtensions;
    private final boolean writeReport;
    private final boolean logToDirectory;

    private ConverterSettings(Builder b) {
        this.decimals = b.decimals;
        this.delimiter = b.delimiter;
        this.importParams = Collections.unmodifiableList(new ArrayList<>(b.importParams));
        this.pixelSizeKey = b.pixelSizeKey;
        this.aggregationKey = b.aggregationKey;
        this.wavenumbersKey = b.wavenumbersKey;
        this.batchExtensions = Collections.unmodifiableList(new ArrayList<>(b.batchExtensions));
        this.writeReport = b.writeReport;
        this.logToDirectory = b.logToDirectory;
    }

    /**
     * Settings from the bundled defaults resource.
     */
    public static ConverterSettings defaults() {
        Builder builder = new Builder();
        try (InputStream in = ConverterSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Default settings resource {} not found, using built-in values", DEFAULTS_RESOURCE);
            } else {
                builder.apply(new Yaml().load(in), DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Could not read default settings resource {}", DEFAULTS_RESOURCE, e);
        }
        return builder.build();
    }

    /**
     * Defaults overlaid with the values in a user YAML file.
     *
     * @param configFile the YAML file to read
     * @throws IOException if the file cannot be read
     */
    public static ConverterSettings load(Path configFile) throws IOException {
        logger.info("Reading converter settings from: {}", configFile.toAbsolutePath());
        Builder builder = defaults().toBuilder();
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            Object loaded;
            try {
                loaded = new Yaml().load(reader);
            } catch (RuntimeException e) {
                throw new IOException("Invalid YAML in " + configFile + ": " + e.getMessage(), e);
            }
            if (loaded == null) {
                logger.warn("Settings file is empty: {}", configFile);
            } else {
                builder.apply(loaded, configFile.toString());
            }
        }
        return builder.build();
    }

    public int getDecimals() {
        return decimals;
    }

    public String getDelimiter() {
        return delimiter;
    }

    /** Instrument parameters broadcast as columns for interferogram variants, in output order. */
    public List<String> getImportParams() {
        return importParams;
    }

    public String getPixelSizeKey() {
        return pixelSizeKey;
    }

    public String getAggregationKey() {
        return aggregationKey;
    }

    public String getWavenumbersKey() {
        return wavenumbersKey;
    }

    /** Extensions eligible for batch conversion; empty means every registered extension. */
    public List<String> getBatchExtensions() {
        return batchExtensions;
    }

    public boolean isWriteReport() {
        return writeReport;
    }

    public boolean isLogToDirectory() {
        return logToDirectory;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.decimals = decimals;
        b.delimiter = delimiter;
        b.importParams = new ArrayList<>(importParams);
        b.pixelSizeKey = pixelSizeKey;
        b.aggregationKey = aggregationKey;
        b.wavenumbersKey = wavenumbersKey;
        b.batchExtensions = new ArrayList<>(batchExtensions);
        b.writeReport = writeReport;
        b.logToDirectory = logToDirectory;
        return b;
    }

    @Override
    public String toString() {
        return String.format("ConverterSettings[decimals=%d, delimiter='%s', importParams=%s, batchExtensions=%s]",
                decimals, delimiter, importParams, batchExtensions);
    }

    public static final class Builder {
        private int decimals = 8;
        private String delimiter = ",";
        private List<String> importParams = new ArrayList<>(
                List.of("Effective Laser Wavenumber", "Under Sampling Ratio"));
        private String pixelSizeKey = "FPA Pixel Size";
        private String aggregationKey = "PixelAggregationSize";
        private String wavenumbersKey = "wavenumbers";
        private List<String> batchExtensions = new ArrayList<>();
        private boolean writeReport = true;
        private boolean logToDirectory = true;

        public Builder decimals(int decimals) {
            if (decimals < 0 || decimals > 17) {
                throw new IllegalArgumentException("Decimals must be between 0 and 17, got " + decimals);
            }
            this.decimals = decimals;
            return this;
        }

        public Builder delimiter(String delimiter) {
            if (delimiter == null || delimiter.isEmpty()) {
                throw new IllegalArgumentException("Delimiter must not be empty");
            }
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Sets the instrument parameters to broadcast. Blank and repeated names are dropped,
         * as are {@code map_x}/{@code map_y}, which are always the coordinate columns.
         */
        public Builder importParams(List<String> importParams) {
            List<String> accepted = new ArrayList<>();
            for (String name : importParams) {
                if (name == null || name.isBlank()) {
                    logger.warn("Ignoring blank metadata.import_params entry");
                } else if (RESERVED_COLUMNS.contains(name)) {
                    logger.warn("Ignoring metadata.import_params entry '{}': reserved for coordinates", name);
                } else if (accepted.contains(name)) {
                    logger.warn("Ignoring repeated metadata.import_params entry '{}'", name);
                } else {
                    accepted.add(name);
                }
            }
            this.importParams = accepted;
            return this;
        }

        public Builder pixelSizeKey(String key) {
            this.pixelSizeKey = key;
            return this;
        }

        public Builder aggregationKey(String key) {
            this.aggregationKey = key;
            return this;
        }

        public Builder wavenumbersKey(String key) {
            this.wavenumbersKey = key;
            return this;
        }

        /**
         * Sets the batch extensions, normalized to lowercase with a leading dot.
         * Blank and repeated entries are dropped.
         */
        public Builder batchExtensions(List<String> extensions) {
            List<String> accepted = new ArrayList<>();
            for (String extension : extensions) {
                if (extension == null || extension.isBlank() || extension.trim().equals(".")) {
                    logger.warn("Ignoring blank batch.extensions entry '{}'", extension);
                    continue;
                }
                String normalized = CubeSourceRegistry.normalizeExtension(extension);
                if (!accepted.contains(normalized)) {
                    accepted.add(normalized);
                }
            }
            this.batchExtensions = accepted;
            return this;
        }

        public Builder writeReport(boolean writeReport) {
            this.writeReport = writeReport;
            return this;
        }

        public Builder logToDirectory(boolean logToDirectory) {
            this.logToDirectory = logToDirectory;
            return this;
        }

        public ConverterSettings build() {
            return new ConverterSettings(this);
        }

        void apply(Object loaded, String origin) {
            if (!(loaded instanceof Map)) {
                logger.warn("YAML root is not a map in {} - ignoring", origin);
                return;
            }
            Map<String, Object> root = asMap(loaded);

            Map<String, Object> format = getMap(root, "format");
            Integer dec = getInteger(format, "decimals", origin);
            if (dec != null) {
                try {
                    decimals(dec);
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring format.decimals in {}: {}", origin, e.getMessage());
                }
            }
            String delim = getString(format, "delimiter");
            if (delim != null) {
                if (delim.isEmpty()) {
                    logger.warn("Ignoring empty format.delimiter in {}", origin);
                } else {
                    delimiter = delim;
                }
            }

            Map<String, Object> metadata = getMap(root, "metadata");
            List<String> params = getStringList(metadata, "import_params", origin);
            if (params != null) {
                importParams(params);
            }
            pixelSizeKey = orDefault(getString(metadata, "pixel_size_key"), pixelSizeKey);
            aggregationKey = orDefault(getString(metadata, "aggregation_key"), aggregationKey);
            wavenumbersKey = orDefault(getString(metadata, "wavenumbers_key"), wavenumbersKey);

            Map<String, Object> batch = getMap(root, "batch");
            List<String> extensions = getStringList(batch, "extensions", origin);
            if (extensions != null) {
                batchExtensions(extensions);
            }
            Boolean report = getBoolean(batch, "write_report", origin);
            if (report != null) {
                writeReport = report;
            }
            Boolean logDir = getBoolean(batch, "log_to_directory", origin);
            if (logDir != null) {
                logToDirectory = logDir;
            }
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> getMap(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return (value instanceof Map) ? asMap(value) : null;
    }

    private static String getString(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return (value != null) ? value.toString() : null;
    }

    private static Integer getInteger(Map<String, Object> data, String key, String origin) {
        if (data == null || !data.containsKey(key)) return null;
        Object value = data.get(key);
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring unparseable value '{}' for '{}' in {}", value, key, origin);
                return null;
            }
        }
        logger.warn("Ignoring non-integer value '{}' for '{}' in {}", value, key, origin);
        return null;
    }

    private static Boolean getBoolean(Map<String, Object> data, String key, String origin) {
        if (data == null || !data.containsKey(key)) return null;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        logger.warn("Ignoring non-boolean value '{}' for '{}' in {}", value, key, origin);
        return null;
    }

    private static List<String> getStringList(Map<String, Object> data, String key, String origin) {
        if (data == null || !data.containsKey(key)) return null;
        Object value = data.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof List)) {
            logger.warn("Ignoring non-list value '{}' for '{}' in {}", value, key, origin);
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
