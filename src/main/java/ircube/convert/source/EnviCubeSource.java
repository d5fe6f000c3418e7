package ircube.convert.source;

import ircube.convert.model.CubeData;
import ircube.convert.model.CubeMetadata;
import ircube.convert.model.CubeVariant;
import ircube.convert.model.SpectralCube;
import ircube.convert.model.WavelengthAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reader for ENVI spectral images: a plain-text {@code .hdr} header next to a raw binary data file.
 *
 * <p>Supported header keys:</p>
 * <ul>
 *   <li>{@code samples}, {@code lines}, {@code bands} - columns, rows and spectral samples (required)</li>
 *   <li>{@code data type} - 1 (uint8), 2 (int16), 3 (int32), 4 (float32), 5 (float64), 12 (uint16)</li>
 *   <li>{@code interleave} - bsq (default), bil or bip</li>
 *   <li>{@code header offset}, {@code byte order} (0 little-endian, 1 big-endian)</li>
 *   <li>{@code wavelength} - spectral axis</li>
 *   <li>{@code pixel size} or {@code map info} - physical pixel size, exposed as {@code FPA Pixel Size}</li>
 *   <li>{@code data file} - explicit data file name relative to the header</li>
 * </ul>
 *
 * <p>The data file defaults to the header path without {@code .hdr}, then with {@code .img},
 * {@code .dat} or {@code .raw} in its place.</p>
 */
public class EnviCubeSource implements CubeSource {

    private static final Logger logger = LoggerFactory.getLogger(EnviCubeSource.class);

    static final String PIXEL_SIZE_KEY = "FPA Pixel Size";
    static final String AGGREGATION_KEY = "PixelAggregationSize";

    private static final String[] DATA_EXTENSIONS = {"", ".img", ".dat", ".raw"};

    @Override
    public CubeVariant getVariant() {
        return CubeVariant.ENVI;
    }

    @Override
    public CubeData read(Path path) throws CubeParseException {
        Map<String, String> header = readHeader(path);

        int columns = requireInt(header, "samples", path);
        int rows = requireInt(header, "lines", path);
        int bands = requireInt(header, "bands", path);
        if (rows <= 0 || columns <= 0 || bands <= 0) {
            throw new CubeParseException(String.format(
                    "ENVI header %s declares an empty cube (%d lines, %d samples, %d bands)",
                    path, rows, columns, bands));
        }
        int dataType = requireInt(header, "data type", path);
        int offset = optionalInt(header, "header offset", 0, path);
        int byteOrder = optionalInt(header, "byte order", 0, path);
        String interleave = header.getOrDefault("interleave", "bsq").trim().toLowerCase(Locale.ROOT);

        int bytesPerValue = bytesPerValue(dataType, path);
        if (!interleave.equals("bsq") && !interleave.equals("bil") && !interleave.equals("bip")) {
            throw new CubeParseException("Unsupported interleave '" + interleave + "' in " + path);
        }

        Path dataFile = resolveDataFile(path, header);
        long valueCount = (long) rows * columns * bands;
        long byteCount = valueCount * bytesPerValue;
        if (byteCount > Integer.MAX_VALUE) {
            throw new CubeParseException("Cube in " + dataFile + " is too large to load (" + byteCount + " bytes)");
        }

        logger.debug("Reading ENVI cube {}: {} x {} x {}, type {}, {} interleave, offset {}",
                dataFile, rows, columns, bands, dataType, interleave, offset);

        ByteBuffer buffer = readBytes(dataFile, offset, (int) byteCount);
        buffer.order(byteOrder == 1 ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);

        float[] data = new float[(int) valueCount];
        switch (interleave) {
            case "bip":
                for (int i = 0; i < data.length; i++) {
                    data[i] = readValue(buffer, dataType);
                }
                break;
            case "bil":
                for (int r = 0; r < rows; r++) {
                    for (int w = 0; w < bands; w++) {
                        for (int c = 0; c < columns; c++) {
                            data[(r * columns + c) * bands + w] = readValue(buffer, dataType);
                        }
                    }
                }
                break;
            default:
                for (int w = 0; w < bands; w++) {
                    for (int r = 0; r < rows; r++) {
                        for (int c = 0; c < columns; c++) {
                            data[(r * columns + c) * bands + w] = readValue(buffer, dataType);
                        }
                    }
                }
                break;
        }

        SpectralCube cube = new SpectralCube(rows, columns, bands, data);
        WavelengthAxis axis = parseWavelengths(header, bands, path);
        CubeMetadata metadata = buildMetadata(header, path);

        return new CubeData(path, CubeVariant.ENVI, cube, axis, metadata);
    }

    /**
     * Parses the header into lowercase keys and raw values. Braced values may span lines
     * and are kept with their braces.
     */
    static Map<String, String> readHeader(Path path) throws CubeParseException {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new CubeParseException("Cannot read ENVI header " + path, e);
        }

        int first = 0;
        while (first < lines.size() && lines.get(first).trim().isEmpty()) {
            first++;
        }
        if (first >= lines.size() || !lines.get(first).trim().startsWith("ENVI")) {
            throw new CubeParseException("Not an ENVI header (missing 'ENVI' signature): " + path);
        }

        Map<String, String> header = new LinkedHashMap<>();
        for (int i = first + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = line.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            StringBuilder value = new StringBuilder(line.substring(eq + 1).trim());
            if (value.toString().startsWith("{")) {
                while (value.indexOf("}") < 0 && i + 1 < lines.size()) {
                    value.append(' ').append(lines.get(++i).trim());
                }
                if (value.indexOf("}") < 0) {
                    throw new CubeParseException("Unterminated '{' for key '" + key + "' in " + path);
                }
            }
            header.put(key, value.toString());
        }
        return header;
    }

    /** Splits a {@code {a, b, c}} value into its trimmed items. */
    static List<String> splitBraced(String value) {
        String inner = value.trim();
        if (inner.startsWith("{")) {
            inner = inner.substring(1);
        }
        int close = inner.lastIndexOf('}');
        if (close >= 0) {
            inner = inner.substring(0, close);
        }
        List<String> items = new ArrayList<>();
        for (String part : inner.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) {
                items.add(t);
            }
        }
        return items;
    }

    private static WavelengthAxis parseWavelengths(Map<String, String> header, int bands, Path path)
            throws CubeParseException {
        String raw = header.get("wavelength");
        if (raw == null) {
            return null;
        }
        List<String> items = splitBraced(raw);
        if (items.size() != bands) {
            logger.warn("Ignoring wavelength list in {}: {} values for {} bands", path, items.size(), bands);
            return null;
        }
        double[] values = new double[bands];
        for (int i = 0; i < bands; i++) {
            try {
                values[i] = Double.parseDouble(items.get(i));
            } catch (NumberFormatException e) {
                throw new CubeParseException("Invalid wavelength '" + items.get(i) + "' in " + path, e);
            }
        }
        return WavelengthAxis.of(values);
    }

    private static CubeMetadata buildMetadata(Map<String, String> header, Path path) {
        Map<String, Object> entries = new LinkedHashMap<>(header);
        Double pixelSize = parsePixelSize(header);
        if (pixelSize != null) {
            entries.put(PIXEL_SIZE_KEY, pixelSize);
            entries.put(AGGREGATION_KEY, 1.0);
        } else {
            logger.debug("No pixel size in ENVI header {}", path);
        }
        return CubeMetadata.of(entries);
    }

    private static Double parsePixelSize(Map<String, String> header) {
        try {
            String pixelSize = header.get("pixel size");
            if (pixelSize != null) {
                List<String> items = splitBraced(pixelSize);
                if (!items.isEmpty()) {
                    return Double.parseDouble(items.get(0));
                }
            }
            String mapInfo = header.get("map info");
            if (mapInfo != null) {
                List<String> items = splitBraced(mapInfo);
                if (items.size() > 5) {
                    return Double.parseDouble(items.get(5));
                }
            }
        } catch (NumberFormatException e) {
            logger.debug("Unparseable pixel size in ENVI header: {}", e.getMessage());
        }
        return null;
    }

    private static Path resolveDataFile(Path headerPath, Map<String, String> header) throws CubeParseException {
        Path dir = headerPath.toAbsolutePath().getParent();
        String explicit = header.get("data file");
        if (explicit != null && !explicit.isBlank()) {
            Path candidate = dir.resolve(explicit.trim());
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            throw new CubeParseException("Data file named in header does not exist: " + candidate);
        }

        String name = headerPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        for (String ext : DATA_EXTENSIONS) {
            Path candidate = dir.resolve(base + ext);
            if (!candidate.equals(headerPath.toAbsolutePath()) && Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new CubeParseException("No data file found next to ENVI header " + headerPath);
    }

    private static ByteBuffer readBytes(Path dataFile, long offset, int length) throws CubeParseException {
        try (FileChannel channel = FileChannel.open(dataFile, StandardOpenOption.READ)) {
            if (channel.size() < offset + length) {
                throw new CubeParseException(String.format(
                        "Data file %s is truncated: %d bytes, expected at least %d",
                        dataFile, channel.size(), offset + length));
            }
            ByteBuffer buffer = ByteBuffer.allocate(length);
            channel.position(offset);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new CubeParseException("Unexpected end of data file " + dataFile);
                }
            }
            buffer.flip();
            return buffer;
        } catch (CubeParseException e) {
            throw e;
        } catch (IOException e) {
            throw new CubeParseException("Cannot read data file " + dataFile, e);
        }
    }

    private static int bytesPerValue(int dataType, Path path) throws CubeParseException {
        switch (dataType) {
            case 1:
                return 1;
            case 2:
            case 12:
                return 2;
            case 3:
            case 4:
                return 4;
            case 5:
                return 8;
            default:
                throw new CubeParseException("Unsupported ENVI data type " + dataType + " in " + path);
        }
    }

    private static float readValue(ByteBuffer buffer, int dataType) {
        switch (dataType) {
            case 1:
                return buffer.get() & 0xFF;
            case 2:
                return buffer.getShort();
            case 12:
                return buffer.getShort() & 0xFFFF;
            case 3:
                return buffer.getInt();
            case 4:
                return buffer.getFloat();
            default:
                return (float) buffer.getDouble();
        }
    }

    private static int requireInt(Map<String, String> header, String key, Path path) throws CubeParseException {
        String value = header.get(key);
        if (value == null) {
            throw new CubeParseException("ENVI header " + path + " is missing '" + key + "'");
        }
        return parseInt(key, value, path);
    }

    private static int optionalInt(Map<String, String> header, String key, int defaultValue, Path path)
            throws CubeParseException {
        String value = header.get(key);
        return value == null ? defaultValue : parseInt(key, value, path);
    }

    private static int parseInt(String key, String value, Path path) throws CubeParseException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CubeParseException("Invalid value '" + value + "' for '" + key + "' in " + path, e);
        }
    }
}
