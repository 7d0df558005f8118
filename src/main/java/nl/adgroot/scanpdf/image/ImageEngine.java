package nl.adgroot.scanpdf.image;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Pixel-level operations the exporter delegates: decoding a page to pixels,
 * black/white reduction and encoding.
 */
public interface ImageEngine {

  /** Decodes (or rasterizes, for PDF sources) the page. The caller owns the result. */
  MemoryImage render(PageImage page) throws IOException;

  /** Reduces the image to 1-bit black and white. The input is left untouched. */
  MemoryImage blackWhite(MemoryImage image);

  void encode(MemoryImage image, ImageFileFormat format, PixelFormat pixelFormatHint, OutputStream out)
      throws IOException;
}
