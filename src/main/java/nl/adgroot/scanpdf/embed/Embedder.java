package nl.adgroot.scanpdf.embed;

import java.io.IOException;
import java.io.OutputStream;

import nl.adgroot.scanpdf.image.ImageExportFormat;
import nl.adgroot.scanpdf.image.ImageFileFormat;
import nl.adgroot.scanpdf.image.ImageMetadata;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Supplies the encoded image of one page and its intrinsic geometry.
 * Instances own the resources they wrap; {@link #close()} releases them once.
 */
public interface Embedder extends AutoCloseable {

  /** Chooses the final file and pixel format; may reduce the image to black/white. */
  ImageExportFormat prepareForExport(ImageMetadata metadata);

  /** Writes the encoded image in {@link #originalFileFormat()}. */
  void copyToStream(OutputStream out) throws IOException;

  /** Creates the image object to draw into {@code doc} in the given export format. */
  PDImageXObject toImageXObject(PDDocument doc, ImageExportFormat format) throws IOException;

  int width();

  int height();

  double horizontalDpi();

  double verticalDpi();

  ImageFileFormat originalFileFormat();

  @Override
  void close();
}
