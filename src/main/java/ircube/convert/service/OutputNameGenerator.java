package ircube.convert.service;

import java.nio.file.Path;

/**
 * Output file names for converted tables.
 *
 * <ul>
 *   <li>Single-file mode appends {@code -converted.csv} to the full input path:
 *       {@code scan.dat -> scan.dat-converted.csv}</li>
 *   <li>Batch mode replaces the extension: {@code scan.dat -> scan_converted.csv}</li>
 * </ul>
 */
public final class OutputNameGenerator {

    public static final String SINGLE_FILE_SUFFIX = "-converted.csv";
    public static final String BATCH_SUFFIX = "_converted.csv";

    private OutputNameGenerator() {
        // Utility class - no instantiation
    }

    public static Path singleFileOutput(Path input) {
        return input.resolveSibling(fileName(input) + SINGLE_FILE_SUFFIX);
    }

    public static Path batchOutput(Path input) {
        String name = fileName(input);
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + BATCH_SUFFIX);
    }

    private static String fileName(Path input) {
        if (input == null || input.getFileName() == null) {
            throw new IllegalArgumentException("Input path has no file name: " + input);
        }
        return input.getFileName().toString();
    }
}
