package ircube.convert.service;

import ircube.convert.model.CubeData;
import ircube.convert.model.FlattenedCube;
import ircube.convert.model.MetaTable;
import ircube.convert.model.SpectralTable;
import ircube.convert.preferences.ConverterSettings;
import ircube.convert.processing.CubeFlattener;
import ircube.convert.processing.MetadataAugmenter;
import ircube.convert.processing.SerializationException;
import ircube.convert.processing.SpectralTableWriter;
import ircube.convert.processing.TableAssembler;
import ircube.convert.source.CubeParseException;
import ircube.convert.source.CubeSource;
import ircube.convert.source.CubeSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Single-file conversion pipeline: read, flatten, augment, assemble, write.
 *
 * <p>Failures propagate to the caller. Metadata gaps (no spectral axis, no pixel size,
 * absent instrument parameters) are resolved with defaults and never reported as errors.</p>
 */
public class CubeConversionService {

    private static final Logger logger = LoggerFactory.getLogger(CubeConversionService.class);

    private final CubeSourceRegistry registry;
    private final ConverterSettings settings;
    private final CubeFlattener flattener;
    private final MetadataAugmenter augmenter;
    private final TableAssembler assembler;
    private final SpectralTableWriter writer;

    public CubeConversionService(CubeSourceRegistry registry, ConverterSettings settings) {
        this.registry = registry;
        this.settings = settings;
        this.flattener = new CubeFlattener(
                settings.getPixelSizeKey(), settings.getAggregationKey(), settings.getWavenumbersKey());
        this.augmenter = new MetadataAugmenter(settings.getImportParams());
        this.assembler = new TableAssembler();
        this.writer = new SpectralTableWriter(settings.getDecimals(), settings.getDelimiter());
    }

    public CubeSourceRegistry getRegistry() {
        return registry;
    }

    public ConverterSettings getSettings() {
        return settings;
    }

    /**
     * Converts {@code input} to {@code <input>-converted.csv}.
     *
     * @return the written file
     * @throws CubeParseException if the input cannot be decoded
     * @throws SerializationException if the output cannot be written
     */
    public Path convert(Path input) throws IOException {
        return convert(input, OutputNameGenerator.singleFileOutput(input));
    }

    /**
     * Converts {@code input} and writes the table to {@code output}.
     *
     * @return {@code output}
     * @throws CubeParseException if the input cannot be decoded
     * @throws SerializationException if the output cannot be written
     */
    public Path convert(Path input, Path output) throws IOException {
        CubeSource source = registry.require(input);
        logger.info("Reading {} as {}", input, source.getVariant().getDescription());
        CubeData data = source.read(input);

        SpectralTable table = buildTable(data);
        String header = assembler.buildHeader(table, settings.getDelimiter());
        writer.write(table, header, output);
        logger.info("Converted {} -> {}", input, output);
        return output;
    }

    /**
     * Builds the output table for an already decoded file. Interferogram variants get the
     * configured instrument parameters as extra columns.
     */
    public SpectralTable buildTable(CubeData data) {
        FlattenedCube flattened = flattener.flatten(data);
        int rows = flattened.spectra().getRows();
        MetaTable augmented = data.variant().isInterferogram()
                ? augmenter.augment(data.metadata(), rows)
                : MetaTable.empty(rows);
        SpectralTable table = assembler.assemble(flattened, augmented);
        logger.debug("Assembled {} for {}", table, data.source());
        return table;
    }
}
