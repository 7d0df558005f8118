package nl.adgroot.scanpdf.ocr;

/**
 * OCR settings for one export: what to recognize and how urgently.
 */
public record OcrContext(OcrParams params, OcrPriority priority) {

  public static OcrContext foreground(String languageCode) {
    return new OcrContext(new OcrParams(languageCode), OcrPriority.FOREGROUND);
  }
}
