package ircube.convert.source;

import ircube.convert.model.CubeData;
import ircube.convert.model.CubeVariant;

import java.nio.file.Path;
import java.util.List;

/**
 * Decoder that turns one spectral image file into a raw cube plus instrument metadata.
 *
 * <p>Vendor binary readers plug in here. Implementations are looked up through
 * {@link CubeSourceRegistry} by file extension and may be registered programmatically or
 * listed in {@code META-INF/services/ircube.convert.source.CubeSource}.</p>
 *
 * <p>Implementations should be stateless; the converter calls {@link #read(Path)} once per
 * file and holds at most one decoded cube at a time.</p>
 *
 * @see CubeSourceRegistry
 */
public interface CubeSource {

    /**
     * The variant this source decodes. Interferogram variants change how the decoded cube is
     * turned into a table.
     */
    CubeVariant getVariant();

    /**
     * Lowercase extensions, including the dot, that this source accepts.
     * Defaults to the variant's extension.
     */
    default List<String> getExtensions() {
        return List.of(getVariant().getExtension());
    }

    /**
     * Higher values win when several sources claim the same extension.
     */
    default int getPriority() {
        return 0;
    }

    /**
     * Decodes a file.
     *
     * @param path the file to read
     * @return the decoded cube, axis and metadata
     * @throws CubeParseException if the file is missing, truncated or not in this source's format
     */
    CubeData read(Path path) throws CubeParseException;
}
