package nl.adgroot.scanpdf.embed;

import java.io.IOException;
import java.io.OutputStream;

import nl.adgroot.scanpdf.image.ImageEngine;
import nl.adgroot.scanpdf.image.ImageExportFormat;
import nl.adgroot.scanpdf.image.ImageFileFormat;
import nl.adgroot.scanpdf.image.ImageMetadata;
import nl.adgroot.scanpdf.image.MemoryImage;
import nl.adgroot.scanpdf.image.PixelFormat;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Embeds decoded pixels by encoding them afresh.
 */
public class RenderedImageEmbedder implements Embedder {

  private final ImageEngine engine;
  private final float jpegQuality;
  private MemoryImage image;
  private boolean closed;

  public RenderedImageEmbedder(ImageEngine engine, MemoryImage image, float jpegQuality) {
    this.engine = engine;
    this.image = image;
    this.jpegQuality = jpegQuality;
  }

  @Override
  public synchronized ImageExportFormat prepareForExport(ImageMetadata metadata) {
    ImageExportFormat format = ImageExportFormats.choose(image, metadata.bitDepth(), metadata.lossless());
    if (format.fileFormat() == ImageFileFormat.UNSPECIFIED) {
      format = format.withFileFormat(ImageFileFormat.JPEG);
    }
    if (format.pixelFormat() == PixelFormat.BW1 && image.logicalPixelFormat() != PixelFormat.BW1) {
      MemoryImage reduced = engine.blackWhite(image);
      image.close();
      image = reduced;
    }
    return format;
  }

  @Override
  public synchronized void copyToStream(OutputStream out) throws IOException {
    // PDF consumers need RGB channels
    engine.encode(image, originalFileFormat(), PixelFormat.RGB24, out);
  }

  @Override
  public synchronized PDImageXObject toImageXObject(PDDocument doc, ImageExportFormat format) throws IOException {
    if (format.fileFormat() == ImageFileFormat.JPEG) {
      return JPEGFactory.createFromImage(doc, image.toPixelFormat(format.pixelFormat()), jpegQuality);
    }
    return LosslessFactory.createFromImage(doc, image.toPixelFormat(format.pixelFormat()));
  }

  @Override
  public synchronized int width() {
    return image.width();
  }

  @Override
  public synchronized int height() {
    return image.height();
  }

  @Override
  public synchronized double horizontalDpi() {
    return image.horizontalDpi();
  }

  @Override
  public synchronized double verticalDpi() {
    return image.verticalDpi();
  }

  /** PNG when the pixels came from a PNG, JPEG otherwise. */
  @Override
  public synchronized ImageFileFormat originalFileFormat() {
    return image.originalFileFormat() == ImageFileFormat.PNG ? ImageFileFormat.PNG : ImageFileFormat.JPEG;
  }

  synchronized MemoryImage image() {
    return image;
  }

  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    image.close();
  }
}
