package ircube.convert.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Everything a {@link ircube.convert.source.CubeSource} decodes from one file.
 *
 * @param source the file that was read
 * @param variant the variant the source decoded the file as
 * @param cube the raw (R, C, W) cube
 * @param wavelengths the spectral axis, or null when the reader does not know it directly
 * @param metadata instrument metadata, never null
 */
public record CubeData(Path source, CubeVariant variant, SpectralCube cube,
                       WavelengthAxis wavelengths, CubeMetadata metadata) {

    public CubeData {
        if (variant == null) {
            throw new IllegalArgumentException("Variant must not be null");
        }
        if (cube == null) {
            throw new IllegalArgumentException("Cube must not be null");
        }
        if (wavelengths != null && wavelengths.size() != cube.getBands()) {
            throw new IllegalArgumentException(String.format(
                    "Wavelength axis has %d values but cube has %d bands", wavelengths.size(), cube.getBands()));
        }
        if (metadata == null) {
            metadata = CubeMetadata.empty();
        }
    }

    public Optional<WavelengthAxis> wavelengthAxis() {
        return Optional.ofNullable(wavelengths);
    }
}
