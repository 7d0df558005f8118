package nl.adgroot.scanpdf.pdf;

import java.io.IOException;
import nl.adgroot.scanpdf.image.PageSource;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Opens the source document of a PDF-backed page. The caller closes it.
 */
public final class PdfSources {

  private PdfSources() {}

  public static PDDocument open(PageSource source) throws IOException {
    if (source instanceof PageSource.PdfFile file) {
      return Loader.loadPDF(file.path().toFile());
    }
    if (source instanceof PageSource.PdfMemory memory) {
      return Loader.loadPDF(memory.bytes());
    }
    throw new IllegalArgumentException("Not a PDF source: " + source.getClass().getSimpleName());
  }
}
