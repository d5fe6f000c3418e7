package ircube.convert.service;

import ircube.convert.model.BatchReport;
import ircube.convert.model.ConversionResult;
import ircube.convert.preferences.ConverterSettings;
import ircube.convert.source.CubeSourceRegistry;
import ircube.convert.utilities.ConversionLogSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Converts many files, one at a time, isolating failures per file.
 *
 * <p>Each file's outcome becomes a {@link ConversionResult}; a file that cannot be read or
 * written is recorded as failed and the loop moves on. Outputs are written next to their
 * inputs as {@code <name>_converted.csv}. Only one decoded cube is held in memory at a time.</p>
 */
public class BatchConverter {

    private static final Logger logger = LoggerFactory.getLogger(BatchConverter.class);

    private final CubeConversionService service;
    private final BatchReportWriter reportWriter = new BatchReportWriter();

    public BatchConverter(CubeConversionService service) {
        this.service = service;
    }

    /**
     * Converts every eligible file in {@code directory}, in directory-listing order.
     * Depending on the settings, logs into {@code conversion.log} and writes
     * {@code conversion_report.json} in the same directory.
     *
     * @throws IOException if the directory itself cannot be listed
     */
    public BatchReport convertDirectory(Path directory) throws IOException {
        ConverterSettings settings = service.getSettings();
        DirectoryPathProvider provider = new DirectoryPathProvider(directory, eligibility());

        BatchReport report;
        if (settings.isLogToDirectory()) {
            try (ConversionLogSession session = ConversionLogSession.start(directory)) {
                report = convertAll(provider.listPaths(), directory);
            }
        } else {
            report = convertAll(provider.listPaths(), directory);
        }

        if (settings.isWriteReport()) {
            Path reportPath = directory.resolve(BatchReportWriter.REPORT_FILE_NAME);
            try {
                reportWriter.write(report, reportPath);
                logger.info("Batch report written to {}", reportPath);
            } catch (IOException e) {
                logger.warn("Could not write batch report {}: {}", reportPath, e.getMessage());
            }
        }
        return report;
    }

    /**
     * Converts the files supplied by {@code provider}.
     *
     * @param provider source of input paths
     * @param directory directory recorded in the report, may be null
     * @throws IOException if the provider cannot enumerate its paths
     */
    public BatchReport convertAll(PathListProvider provider, Path directory) throws IOException {
        return convertAll(provider.listPaths(), directory);
    }

    private BatchReport convertAll(List<Path> inputs, Path directory) {
        logger.info("Starting batch conversion of {} files{}", inputs.size(),
                directory == null ? "" : " in " + directory);
        List<ConversionResult> results = new ArrayList<>(inputs.size());
        int index = 0;
        for (Path input : inputs) {
            index++;
            logger.info("Converting {}/{}: {}", index, inputs.size(), input);
            results.add(convertOne(input));
        }
        BatchReport report = new BatchReport(directory, results);
        logger.info("Batch finished: {} converted, {} failed", report.getSuccessCount(), report.getFailureCount());
        for (ConversionResult failure : report.getFailures()) {
            logger.info("  failed: {} ({})", failure.source(), failure.failureMessage());
        }
        return report;
    }

    ConversionResult convertOne(Path input) {
        try {
            Path output = service.convert(input, OutputNameGenerator.batchOutput(input));
            return ConversionResult.success(input, output);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to convert {}", input, e);
            return ConversionResult.failure(input, e);
        } catch (OutOfMemoryError e) {
            // the failed cube is no longer referenced once we get here
            logger.error("Out of memory converting {}", input, e);
            return ConversionResult.failure(input, e);
        }
    }

    /**
     * Files eligible for batch conversion: the configured extensions (already normalized by
     * {@link ConverterSettings}), or every extension with a registered reader when none are configured.
     */
    Predicate<Path> eligibility() {
        List<String> configured = service.getSettings().getBatchExtensions();
        CubeSourceRegistry registry = service.getRegistry();
        if (configured.isEmpty()) {
            return registry::supports;
        }
        return path -> configured.contains(CubeSourceRegistry.extensionOf(path));
    }
}
