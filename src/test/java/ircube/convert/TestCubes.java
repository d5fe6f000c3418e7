package ircube.convert;

import ircube.convert.model.CubeData;
import ircube.convert.model.CubeMetadata;
import ircube.convert.model.CubeVariant;
import ircube.convert.model.SpectralCube;
import ircube.convert.model.WavelengthAxis;

import java.nio.file.Path;
import java.util.Map;

/**
 * Cube fixtures shared by the tests.
 */
public final class TestCubes {

    private TestCubes() {
    }

    /** Value at (r, c, w) is {@code r * 100 + c * 10 + w}. */
    public static SpectralCube indexed(int rows, int cols, int bands) {
        float[] data = new float[rows * cols * bands];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                for (int w = 0; w < bands; w++) {
                    data[(r * cols + c) * bands + w] = r * 100 + c * 10 + w;
                }
            }
        }
        return new SpectralCube(rows, cols, bands, data);
    }

    public static CubeData data(CubeVariant variant, SpectralCube cube, WavelengthAxis axis, Map<String, ?> metadata) {
        return new CubeData(Path.of("sample" + variant.getExtension()), variant, cube, axis, CubeMetadata.of(metadata));
    }
}
