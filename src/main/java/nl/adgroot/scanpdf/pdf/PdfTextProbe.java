package nl.adgroot.scanpdf.pdf;

import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Checks whether a document already carries extractable text.
 */
public final class PdfTextProbe {

  private PdfTextProbe() {}

  /** True if any page has non-whitespace text. */
  public static boolean hasText(PDDocument doc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    int pages = doc.getNumberOfPages();
    for (int i = 1; i <= pages; i++) {
      stripper.setStartPage(i);
      stripper.setEndPage(i);
      if (!stripper.getText(doc).isBlank()) {
        return true;
      }
    }
    return false;
  }
}
