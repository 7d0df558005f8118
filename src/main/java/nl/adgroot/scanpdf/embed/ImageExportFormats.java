package nl.adgroot.scanpdf.embed;

import nl.adgroot.scanpdf.image.BitDepth;
import nl.adgroot.scanpdf.image.ImageExportFormat;
import nl.adgroot.scanpdf.image.ImageFileFormat;
import nl.adgroot.scanpdf.image.MemoryImage;
import nl.adgroot.scanpdf.image.PixelFormat;

public final class ImageExportFormats {

  private ImageExportFormats() {
    // utility class
  }

  /**
   * Picks how a rendered page image is stored in the PDF.
   *
   * <ul>
   *   <li>black/white depth, or an image that already is 1-bit: PNG, 1-bit</li>
   *   <li>lossless, or an image that came from a PNG: PNG in the image's own pixel format
   *       (gray when grayscale depth was asked for)</li>
   *   <li>otherwise JPEG, gray or RGB. The file format is left unspecified when the
   *       image did not originate from a JPEG.</li>
   * </ul>
   */
  public static ImageExportFormat choose(MemoryImage image, BitDepth bitDepth, boolean lossless) {
    PixelFormat logical = image.logicalPixelFormat();

    if (bitDepth == BitDepth.BLACK_WHITE || logical == PixelFormat.BW1) {
      return new ImageExportFormat(ImageFileFormat.PNG, PixelFormat.BW1);
    }

    boolean gray = bitDepth == BitDepth.GRAYSCALE || logical == PixelFormat.GRAY8;

    if (lossless || image.originalFileFormat() == ImageFileFormat.PNG) {
      return new ImageExportFormat(ImageFileFormat.PNG, gray ? PixelFormat.GRAY8 : logical);
    }

    ImageFileFormat fileFormat = image.originalFileFormat() == ImageFileFormat.JPEG
        ? ImageFileFormat.JPEG
        : ImageFileFormat.UNSPECIFIED;
    return new ImageExportFormat(fileFormat, gray ? PixelFormat.GRAY8 : PixelFormat.RGB24);
  }
}
