package nl.adgroot.scanpdf.image;

public record ImageExportFormat(ImageFileFormat fileFormat, PixelFormat pixelFormat) {

  public ImageExportFormat withFileFormat(ImageFileFormat format) {
    return new ImageExportFormat(format, pixelFormat);
  }

  /** The same format with any alpha channel flattened away. */
  public ImageExportFormat withoutAlpha() {
    return pixelFormat == PixelFormat.ARGB32 ? new ImageExportFormat(fileFormat, PixelFormat.RGB24) : this;
  }
}
