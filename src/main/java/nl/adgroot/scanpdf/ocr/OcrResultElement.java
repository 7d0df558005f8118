package nl.adgroot.scanpdf.ocr;

/**
 * One recognized run of text. Bounds are in pixels of the image that was recognized,
 * origin top-left.
 */
public record OcrResultElement(String text, Bounds bounds, boolean rightToLeft) {

  public record Bounds(int x, int y, int width, int height) {}

  public OcrResultElement(String text, int x, int y, int width, int height) {
    this(text, new Bounds(x, y, width, height), false);
  }
}
