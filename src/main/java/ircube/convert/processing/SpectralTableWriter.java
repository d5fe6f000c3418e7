package ircube.convert.processing;

import ircube.convert.model.SpectralTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Writes a {@link SpectralTable} as delimited UTF-8 text.
 *
 * <p>Output layout: the header line as given, then one line per row; every line ends with
 * {@code \n}. Cells are fixed-point with {@code decimals} fraction digits (8 by default,
 * e.g. {@code 12.50000000}), rounded half-even on the exact binary value. Non-finite values
 * are written as {@code nan}, {@code inf} or {@code -inf}. There is no comment prefix and no footer.</p>
 *
 * <p>The destination is created or truncated. A write failure leaves whatever was written
 * so far in place.</p>
 */
public class SpectralTableWriter {

    private static final Logger logger = LoggerFactory.getLogger(SpectralTableWriter.class);

    private final int decimals;
    private final String delimiter;

    public SpectralTableWriter() {
        this(8, ",");
    }

    public SpectralTableWriter(int decimals, String delimiter) {
        if (decimals < 0) {
            throw new IllegalArgumentException("Decimals must not be negative: " + decimals);
        }
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        this.decimals = decimals;
        this.delimiter = delimiter;
    }

    /**
     * @param table the table to write
     * @param header header line content, written verbatim
     * @param destination the file to create or overwrite
     * @throws SerializationException if the file cannot be written
     */
    public void write(SpectralTable table, String header, Path destination) throws SerializationException {
        logger.info("Writing {} to {}", table, destination);
        DecimalFormat format = createFormat();
        int rows = table.getRowCount();
        int cols = table.getColumnCount();

        try (BufferedWriter writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            writer.write(header);
            writer.write('\n');
            StringBuilder line = new StringBuilder();
            for (int r = 0; r < rows; r++) {
                line.setLength(0);
                for (int c = 0; c < cols; c++) {
                    if (c > 0) {
                        line.append(delimiter);
                    }
                    appendValue(line, table.get(r, c), format);
                }
                line.append('\n');
                writer.write(line.toString());
            }
        } catch (IOException e) {
            throw new SerializationException("Failed to write " + destination + ": " + e.getMessage(), e);
        }
        logger.debug("Wrote {} rows x {} columns to {}", rows, cols, destination);
    }

    /**
     * Formats one cell the way {@link #write} does.
     */
    public String formatValue(double value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value, createFormat());
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, double value, DecimalFormat format) {
        if (Double.isNaN(value)) {
            sb.append("nan");
        } else if (Double.isInfinite(value)) {
            sb.append(value > 0 ? "inf" : "-inf");
        } else {
            sb.append(format.format(value));
        }
    }

    private DecimalFormat createFormat() {
        StringBuilder pattern = new StringBuilder("0");
        if (decimals > 0) {
            pattern.append('.');
            for (int i = 0; i < decimals; i++) {
                pattern.append('0');
            }
        }
        DecimalFormat format = new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setGroupingUsed(false);
        return format;
    }
}
