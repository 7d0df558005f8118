package nl.adgroot.scanpdf.image;

/**
 * Frame information read from a JPEG file without decoding it.
 * Densities are 0 when the file carries no JFIF resolution.
 */
public record JpegHeader(int width, int height, int numComponents, double horizontalDpi, double verticalDpi) {}
