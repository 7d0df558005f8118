package nl.adgroot.scanpdf.image;

import org.jetbrains.annotations.Nullable;

/**
 * Export preferences attached to a page image.
 *
 * @param bitDepth  requested bit depth of the exported image
 * @param lossless  whether the page should be stored without lossy compression
 * @param pageSize  expected physical page size, or {@code null} when unknown
 */
public record ImageMetadata(BitDepth bitDepth, boolean lossless, @Nullable PageSize pageSize) {

  public ImageMetadata {
    if (bitDepth == null) {
      bitDepth = BitDepth.COLOR;
    }
  }

  public static ImageMetadata defaults() {
    return new ImageMetadata(BitDepth.COLOR, false, null);
  }

  public ImageMetadata withPageSize(@Nullable PageSize size) {
    return new ImageMetadata(bitDepth, lossless, size);
  }
}
