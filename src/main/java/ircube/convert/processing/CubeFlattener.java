package ircube.convert.processing;

import ircube.convert.model.CubeData;
import ircube.convert.model.CubeMetadata;
import ircube.convert.model.FlattenedCube;
import ircube.convert.model.MetaColumn;
import ircube.convert.model.MetaTable;
import ircube.convert.model.SpectraMatrix;
import ircube.convert.model.SpectralCube;
import ircube.convert.model.WavelengthAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reshapes a (R, C, W) cube into an (R*C, W) spectra matrix and derives a physical
 * {@code map_x}/{@code map_y} coordinate for every spectrum.
 *
 * <p>Pixel ordering is row-major with the row index varying slowest: spectrum {@code i}
 * always belongs to spatial cell {@code (i / C, i % C)}, and its coordinate is
 * {@code (xLocs[i % C], yLocs[i / C])}. The mapping is deterministic.</p>
 *
 * <p>Missing metadata is never an error:</p>
 * <ul>
 *   <li>no spectral axis: the axis becomes 0, 1, ..., W-1</li>
 *   <li>no pixel size fields: the pixel size becomes 1, so coordinates are pixel indices</li>
 * </ul>
 */
public class CubeFlattener {

    private static final Logger logger = LoggerFactory.getLogger(CubeFlattener.class);

    public static final String MAP_X = "map_x";
    public static final String MAP_Y = "map_y";

    private final String pixelSizeKey;
    private final String aggregationKey;
    private final String wavenumbersKey;

    public CubeFlattener() {
        this("FPA Pixel Size", "PixelAggregationSize", "wavenumbers");
    }

    /**
     * @param pixelSizeKey metadata key holding the detector pixel size
     * @param aggregationKey metadata key holding the pixel binning factor
     * @param wavenumbersKey metadata key holding the spectral axis
     */
    public CubeFlattener(String pixelSizeKey, String aggregationKey, String wavenumbersKey) {
        this.pixelSizeKey = pixelSizeKey;
        this.aggregationKey = aggregationKey;
        this.wavenumbersKey = wavenumbersKey;
    }

    /**
     * Flattens a decoded file, resolving its spectral axis and pixel size from the metadata.
     */
    public FlattenedCube flatten(CubeData data) {
        WavelengthAxis axis = resolveAxis(data);
        double pixelSize = resolvePixelSize(data.metadata());
        return flatten(data.cube(), axis, pixelSize);
    }

    /**
     * Flattens a cube.
     *
     * @param cube the cube to flatten
     * @param axis spectral axis of length W, or null for the default integer axis
     * @param pixelSize physical size of one pixel, or null for pixel units
     * @throws IllegalArgumentException if the axis length does not match the cube's band count
     *         or the pixel size is not a positive finite number
     */
    public FlattenedCube flatten(SpectralCube cube, WavelengthAxis axis, Double pixelSize) {
        int rows = cube.getRows();
        int cols = cube.getColumns();
        int bands = cube.getBands();

        WavelengthAxis features = axis != null ? axis : WavelengthAxis.defaultAxis(bands);
        if (features.size() != bands) {
            throw new IllegalArgumentException(String.format(
                    "Axis has %d values but cube has %d bands", features.size(), bands));
        }
        double px = pixelSize != null ? pixelSize : 1.0;
        if (!Double.isFinite(px) || px <= 0) {
            throw new IllegalArgumentException("Pixel size must be positive and finite, got " + px);
        }

        // Row-major (row, column, sample) storage already is the (R*C, W) matrix
        SpectraMatrix spectra = new SpectraMatrix(rows * cols, bands, cube.rawData());

        double[] xLocs = locations(cols, px);
        double[] yLocs = locations(rows, px);

        int n = rows * cols;
        double[] mapX = new double[n];
        double[] mapY = new double[n];
        for (int i = 0; i < n; i++) {
            mapX[i] = xLocs[i % cols];
            mapY[i] = yLocs[i / cols];
        }

        MetaTable coordinates = MetaTable.of(n, List.of(new MetaColumn(MAP_X, mapX), new MetaColumn(MAP_Y, mapY)));
        logger.debug("Flattened {} into {} spectra (pixel size {})", cube, n, px);
        return new FlattenedCube(features, spectra, coordinates);
    }

    /**
     * Evenly spaced positions {@code 0, px, 2*px, ...} for {@code count} pixels, computed as
     * {@code i * (count * px / count)} so that the sequence spans {@code [0, count * px)}.
     */
    public static double[] locations(int count, double pixelSize) {
        double[] locs = new double[count];
        if (count == 0) {
            return locs;
        }
        double step = (count * pixelSize) / count;
        for (int i = 0; i < count; i++) {
            locs[i] = i * step;
        }
        return locs;
    }

    /**
     * Spectral axis for a decoded file. Interferogram variants always use the default
     * integer axis. Otherwise the reader's axis wins, then the metadata axis, then the default.
     *
     * @return the axis, or null when the default integer axis applies
     */
    public WavelengthAxis resolveAxis(CubeData data) {
        if (data.variant().isInterferogram()) {
            return null;
        }
        if (data.wavelengths() != null) {
            return data.wavelengths();
        }
        double[] fromMetadata = data.metadata().getDoubleArray(wavenumbersKey);
        if (fromMetadata == null) {
            logger.debug("No '{}' in metadata of {}, counting samples from 0", wavenumbersKey, data.source());
            return null;
        }
        if (fromMetadata.length != data.cube().getBands()) {
            logger.debug("Ignoring '{}' of length {} for cube with {} bands",
                    wavenumbersKey, fromMetadata.length, data.cube().getBands());
            return null;
        }
        return WavelengthAxis.of(fromMetadata);
    }

    /**
     * Pixel size as detector pixel size times aggregation factor, or 1 when either field is
     * missing or unusable.
     */
    public double resolvePixelSize(CubeMetadata metadata) {
        Double size = metadata.getDouble(pixelSizeKey);
        Double aggregation = metadata.getDouble(aggregationKey);
        if (size == null || aggregation == null) {
            logger.debug("Pixel size fields '{}'/'{}' not available, using pixel units", pixelSizeKey, aggregationKey);
            return 1.0;
        }
        double px = size * aggregation;
        if (!Double.isFinite(px) || px <= 0) {
            logger.debug("Unusable pixel size {} x {}, using pixel units", size, aggregation);
            return 1.0;
        }
        return px;
    }
}
