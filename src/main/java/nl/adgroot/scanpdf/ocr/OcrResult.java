package nl.adgroot.scanpdf.ocr;

import java.util.List;

/**
 * Text recognized on one page image of {@code pageWidth} x {@code pageHeight} pixels.
 */
public record OcrResult(int pageWidth, int pageHeight, List<OcrResultElement> elements) {

  public OcrResult {
    elements = elements == null ? List.of() : List.copyOf(elements);
  }
}
