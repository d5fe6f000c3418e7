package ircube.convert.model;

/**
 * Source file variants the converter knows about.
 *
 * <p>Interferogram (IFG) variants carry raw detector signal instead of calibrated
 * intensities: their spectral axis is always the default integer axis, and a fixed set
 * of instrument parameters is attached to every row of the output table.</p>
 */
public enum CubeVariant {

    IMAGE(".dat", "Agilent Single Tile Image", false),
    IMAGE_IFG(".seq", "Agilent Single Tile Image (IFG)", true),
    MOSAIC(".dmt", "Agilent Mosaic Image", false),
    MOSAIC_IFG(".dmt", "Agilent Mosaic Image (IFG)", true),
    ENVI(".hdr", "ENVI Spectral Image", false);

    private final String extension;
    private final String description;
    private final boolean interferogram;

    CubeVariant(String extension, String description, boolean interferogram) {
        this.extension = extension;
        this.description = description;
        this.interferogram = interferogram;
    }

    /** Lowercase extension including the leading dot. */
    public String getExtension() {
        return extension;
    }

    public String getDescription() {
        return description;
    }

    public boolean isInterferogram() {
        return interferogram;
    }
}
