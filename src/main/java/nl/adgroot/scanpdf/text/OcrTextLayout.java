package nl.adgroot.scanpdf.text;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import nl.adgroot.scanpdf.ocr.OcrResult;
import nl.adgroot.scanpdf.ocr.OcrResultElement;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sizes and positions OCR elements so the invisible text covers the words it was
 * recognized from.
 */
public class OcrTextLayout {

  private static final Logger log = LoggerFactory.getLogger(OcrTextLayout.class);

  // recognized "lines" drawn this large are almost always table rules or underlines
  static final int MAX_DASH_FONT_SIZE = 100;

  private final PDFont font;
  private final float ascentPerUnit;
  private final float lineHeightPerUnit;

  public OcrTextLayout(PDFont font) {
    this.font = font;

    float ascent = 0;
    float descent = 0;
    PDFontDescriptor fd = font.getFontDescriptor();
    if (fd != null) {
      ascent = fd.getAscent();
      descent = fd.getDescent();
    }
    if (ascent <= 0) {
      PDRectangle bbox = boundingBox(font);
      ascent = bbox.getUpperRightY();
      descent = bbox.getLowerLeftY();
    }
    this.ascentPerUnit = ascent / 1000f;
    this.lineHeightPerUnit = (ascent - descent) / 1000f;
  }

  public PDFont font() {
    return font;
  }

  /** Lays out every drawable element of {@code result} on a page of the given size. */
  public List<TextDrawInfo> layout(OcrResult result, float pageWidth, float pageHeight) {
    List<TextDrawInfo> out = new ArrayList<>();
    if (result.pageWidth() <= 0 || result.pageHeight() <= 0) {
      return out;
    }
    float hScale = pageWidth / result.pageWidth();
    float vScale = pageHeight / result.pageHeight();
    for (OcrResultElement element : result.elements()) {
      TextDrawInfo info = layout(element, hScale, vScale);
      if (info != null) {
        out.add(info);
      }
    }
    return out;
  }

  @Nullable
  TextDrawInfo layout(OcrResultElement element, float hScale, float vScale) {
    String text = element.text();
    if (text == null || text.isEmpty()) return null;

    OcrResultElement.Bounds b = element.bounds();
    float x = b.x() * hScale;
    float y = b.y() * vScale;
    float w = b.width() * hScale;
    float h = b.height() * vScale;

    try {
      int fontSize = calculateFontSize(text, w, h);
      if (fontSize > MAX_DASH_FONT_SIZE && (text.equals("-") || text.equals("_"))) {
        return null;
      }

      float textWidth = measureWidth(text, fontSize);
      float textHeight = lineHeightPerUnit * fontSize;
      float left = x + (w - textWidth) / 2;
      float top = y + (h - textHeight) / 2;

      String drawn = element.rightToLeft() ? Graphemes.reverse(text) : text;
      return new TextDrawInfo(drawn, fontSize, left, top, w, h, textWidth, textHeight, ascentPerUnit * fontSize);
    } catch (IOException | IllegalArgumentException e) {
      // the font has no glyph for some character
      log.warn("OCR text '{}' cannot be drawn with font {}, leaving it out: {}",
          text, font.getName(), e.getMessage());
      return null;
    }
  }

  /**
   * Font size at which {@code text} fills a box {@code boxWidth} wide, starting from a guess
   * equal to the box height.
   */
  int calculateFontSize(String text, float boxWidth, float boxHeight) throws IOException {
    int guess = Math.max(1, (int) boxHeight);
    float measured = measureWidth(text, guess);
    if (measured <= 0) {
      return guess;
    }
    return Math.max(1, (int) Math.floor(guess * boxWidth / measured));
  }

  float measureWidth(String text, float fontSize) throws IOException {
    return font.getStringWidth(text) / 1000f * fontSize;
  }

  private static PDRectangle boundingBox(PDFont font) {
    try {
      return new PDRectangle(font.getBoundingBox());
    } catch (IOException e) {
      log.debug("No bounding box for font {}, using default metrics", font.getName(), e);
      return new PDRectangle(0, -250, 1000, 1000);
    }
  }
}
