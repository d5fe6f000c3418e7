package ircube.convert.processing;

import ircube.convert.model.CubeMetadata;
import ircube.convert.model.MetaColumn;
import ircube.convert.model.MetaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns scalar instrument parameters into constant per-pixel columns.
 *
 * <p>Used for interferogram files, where parameters such as the effective laser
 * wavenumber are needed downstream to process every spectrum. Keys absent from the
 * metadata are skipped without a placeholder column; present keys keep the order of the
 * requested key list.</p>
 */
public class MetadataAugmenter {

    private static final Logger logger = LoggerFactory.getLogger(MetadataAugmenter.class);

    private final List<String> parameterKeys;

    public MetadataAugmenter(List<String> parameterKeys) {
        if (parameterKeys == null) {
            throw new IllegalArgumentException("Parameter key list must not be null");
        }
        this.parameterKeys = List.copyOf(parameterKeys);
    }

    public List<String> getParameterKeys() {
        return parameterKeys;
    }

    /**
     * Builds one column of {@code rowCount} identical values per key present in {@code metadata}.
     * A value that is present but not numeric is skipped with a warning.
     */
    public MetaTable augment(CubeMetadata metadata, int rowCount) {
        List<MetaColumn> columns = new ArrayList<>();
        for (String key : parameterKeys) {
            if (!metadata.contains(key)) {
                logger.debug("Parameter '{}' not in metadata, skipping", key);
                continue;
            }
            Double value = metadata.getDouble(key);
            if (value == null) {
                logger.warn("Parameter '{}' is not numeric ({}), skipping", key, metadata.get(key));
                continue;
            }
            columns.add(MetaColumn.constant(key, value, rowCount));
        }
        return MetaTable.of(rowCount, columns);
    }
}
