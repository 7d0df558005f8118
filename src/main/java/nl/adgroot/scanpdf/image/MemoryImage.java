package nl.adgroot.scanpdf.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;

/**
 * Decoded pixels of one page plus the resolution they were captured at.
 * A resolution of 0 means the source did not report one.
 */
public final class MemoryImage implements AutoCloseable {

  private final BufferedImage image;
  private final double horizontalDpi;
  private final double verticalDpi;
  private final ImageFileFormat originalFileFormat;

  public MemoryImage(BufferedImage image, double horizontalDpi, double verticalDpi, ImageFileFormat originalFileFormat) {
    this.image = image;
    this.horizontalDpi = horizontalDpi;
    this.verticalDpi = verticalDpi;
    this.originalFileFormat = originalFileFormat == null ? ImageFileFormat.UNSPECIFIED : originalFileFormat;
  }

  public BufferedImage image() {
    return image;
  }

  public int width() {
    return image.getWidth();
  }

  public int height() {
    return image.getHeight();
  }

  public double horizontalDpi() {
    return horizontalDpi;
  }

  public double verticalDpi() {
    return verticalDpi;
  }

  public ImageFileFormat originalFileFormat() {
    return originalFileFormat;
  }

  /** Pixel format implied by how the image is stored. */
  public PixelFormat logicalPixelFormat() {
    if (image.getType() == BufferedImage.TYPE_BYTE_BINARY && image.getColorModel().getPixelSize() == 1) {
      return PixelFormat.BW1;
    }
    ColorSpace cs = image.getColorModel().getColorSpace();
    if (cs.getType() == ColorSpace.TYPE_GRAY) {
      return PixelFormat.GRAY8;
    }
    if (image.getColorModel().hasAlpha()) {
      return PixelFormat.ARGB32;
    }
    return PixelFormat.RGB24;
  }

  /** Returns the pixels laid out in the requested format, converting if needed. */
  public BufferedImage toPixelFormat(PixelFormat format) {
    int type = switch (format) {
      case BW1 -> BufferedImage.TYPE_BYTE_BINARY;
      case GRAY8 -> BufferedImage.TYPE_BYTE_GRAY;
      case RGB24 -> BufferedImage.TYPE_INT_RGB;
      case ARGB32 -> BufferedImage.TYPE_INT_ARGB;
    };
    if (image.getType() == type) {
      return image;
    }
    BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), type);
    Graphics2D g = converted.createGraphics();
    try {
      if (format != PixelFormat.ARGB32 && image.getColorModel().hasAlpha()) {
        // transparent areas end up white, as they show on a page
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, image.getWidth(), image.getHeight());
      }
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }
    return converted;
  }

  /** Same resolution and origin, different pixels. */
  public MemoryImage withImage(BufferedImage replacement) {
    return new MemoryImage(replacement, horizontalDpi, verticalDpi, originalFileFormat);
  }

  @Override
  public void close() {
    image.flush();
  }
}
