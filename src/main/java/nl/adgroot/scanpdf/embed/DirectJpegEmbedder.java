package nl.adgroot.scanpdf.embed;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.scanpdf.image.ImageExportFormat;
import nl.adgroot.scanpdf.image.ImageFileFormat;
import nl.adgroot.scanpdf.image.ImageMetadata;
import nl.adgroot.scanpdf.image.JpegHeader;
import nl.adgroot.scanpdf.image.PixelFormat;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Embeds an untouched color JPEG file byte for byte.
 */
public class DirectJpegEmbedder implements Embedder {

  private final JpegHeader header;
  private final Path path;

  public DirectJpegEmbedder(JpegHeader header, Path path) {
    if (header.numComponents() <= 1) {
      throw new IllegalArgumentException("Single-component JPEGs cannot be embedded directly: " + path);
    }
    this.header = header;
    this.path = path;
  }

  @Override
  public ImageExportFormat prepareForExport(ImageMetadata metadata) {
    return new ImageExportFormat(ImageFileFormat.JPEG, PixelFormat.RGB24);
  }

  @Override
  public void copyToStream(OutputStream out) throws IOException {
    Files.copy(path, out);
  }

  @Override
  public PDImageXObject toImageXObject(PDDocument doc, ImageExportFormat format) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return JPEGFactory.createFromStream(doc, in);
    }
  }

  @Override
  public int width() {
    return header.width();
  }

  @Override
  public int height() {
    return header.height();
  }

  @Override
  public double horizontalDpi() {
    return header.horizontalDpi();
  }

  @Override
  public double verticalDpi() {
    return header.verticalDpi();
  }

  @Override
  public ImageFileFormat originalFileFormat() {
    return ImageFileFormat.JPEG;
  }

  @Override
  public void close() {
    // the file is opened per use, nothing is held
  }
}
