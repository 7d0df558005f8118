package nl.adgroot.scanpdf.image;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the pixels (or PDF objects) of a page come from.
 */
public sealed interface PageSource
    permits PageSource.ImageFile, PageSource.Bitmap, PageSource.PdfFile, PageSource.PdfMemory {

  /** A raster image file (JPEG or PNG). */
  record ImageFile(Path path) implements PageSource {
    public ImageFile {
      Objects.requireNonNull(path, "path");
    }
  }

  /** Pixels already decoded in memory. A dpi of 0 means unknown. */
  record Bitmap(BufferedImage image, double dpi, ImageFileFormat originalFormat) implements PageSource {
    public Bitmap {
      Objects.requireNonNull(image, "image");
      if (originalFormat == null) originalFormat = ImageFileFormat.UNSPECIFIED;
    }
  }

  /** A single-page PDF stored on disk. */
  record PdfFile(Path path) implements PageSource {
    public PdfFile {
      Objects.requireNonNull(path, "path");
    }
  }

  /** A single-page PDF held in memory. */
  record PdfMemory(byte[] bytes) implements PageSource {
    public PdfMemory {
      Objects.requireNonNull(bytes, "bytes");
    }
  }
}
