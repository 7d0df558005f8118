package nl.adgroot.scanpdf.pdf;

import java.io.IOException;
import java.util.List;
import nl.adgroot.scanpdf.embed.Embedder;
import nl.adgroot.scanpdf.image.ImageExportFormat;
import nl.adgroot.scanpdf.image.PageSize;
import nl.adgroot.scanpdf.ocr.OcrResult;
import nl.adgroot.scanpdf.text.OcrTextLayout;
import nl.adgroot.scanpdf.text.TextDrawInfo;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.graphics.state.RenderingMode;
import org.apache.pdfbox.util.Matrix;
import org.jetbrains.annotations.Nullable;

/**
 * Draws page images and invisible OCR text.
 */
public final class PageWriter {

  /** How the text layer is attached to the page. */
  public enum TextLayer {
    /**
     * Generated pages: drawn before the image, baseline placed one ascent below the top of
     * the measured text.
     */
    UNDER_IMAGE,
    /**
     * Imported pages: appended as a new content stream after the existing content, bottom
     * of the measured text placed at the bottom of its box.
     */
    OVERLAY
  }

  private PageWriter() {}

  /** Sizes {@code page} to the image and draws it full-bleed. */
  public static void drawImage(PDDocument doc, PDPage page, Embedder embedder, ImageExportFormat format,
      @Nullable PageSize pageSize, PdfCompat compat) throws IOException {

    PageGeometry.Size size = PageGeometry.realSize(embedder, pageSize);
    float width = (float) size.width();
    float height = (float) size.height();
    page.setMediaBox(new PDRectangle(width, height));

    // an alpha channel would be embedded as a soft mask
    ImageExportFormat embedded = compat.allowsTransparency() ? format : format.withoutAlpha();
    PDImageXObject image = embedder.toImageXObject(doc, embedded);
    // PDF/A forbids /Interpolate true
    image.setInterpolate(!compat.isArchival());

    try (PDPageContentStream cs = new PDPageContentStream(doc, page, AppendMode.APPEND, true)) {
      cs.drawImage(image, 0, 0, width, height);
    }
  }

  /**
   * Adds the invisible text of {@code result}. OCR coordinates are relative to the page as
   * displayed, i.e. the crop box turned by the page's {@code /Rotate}.
   */
  public static void drawOcrText(PDDocument doc, PDPage page, OcrTextLayout layout, OcrResult result,
      TextLayer mode) throws IOException {

    PDRectangle box = page.getCropBox();
    int rotation = normalizedRotation(page.getRotation());
    boolean sideways = rotation == 90 || rotation == 270;
    float displayWidth = sideways ? box.getHeight() : box.getWidth();
    float displayHeight = sideways ? box.getWidth() : box.getHeight();

    List<TextDrawInfo> infos = layout.layout(result, displayWidth, displayHeight);
    if (infos.isEmpty()) {
      return;
    }

    AppendMode appendMode = mode == TextLayer.UNDER_IMAGE ? AppendMode.PREPEND : AppendMode.APPEND;
    try (PDPageContentStream cs = new PDPageContentStream(doc, page, appendMode, true, true)) {
      cs.saveGraphicsState();
      cs.transform(displayToUserSpace(box, rotation));
      cs.beginText();
      cs.setRenderingMode(RenderingMode.NEITHER);
      for (TextDrawInfo info : infos) {
        float drop = mode == TextLayer.UNDER_IMAGE ? info.ascent() : info.textHeight();
        float y = displayHeight - (info.y() + drop);
        cs.setFont(layout.font(), info.fontSize());
        cs.setTextMatrix(Matrix.getTranslateInstance(info.x(), y));
        cs.showText(info.text());
      }
      cs.endText();
      cs.restoreGraphicsState();
    }
  }

  /**
   * Maps display coordinates (bottom-left origin of the page as shown) to user space.
   * Viewers turn the page clockwise by {@code rotation} degrees.
   */
  static Matrix displayToUserSpace(PDRectangle box, int rotation) {
    float llx = box.getLowerLeftX();
    float lly = box.getLowerLeftY();
    float w = box.getWidth();
    float h = box.getHeight();
    return switch (rotation) {
      case 90 -> new Matrix(0, 1, -1, 0, llx + w, lly);
      case 180 -> new Matrix(-1, 0, 0, -1, llx + w, lly + h);
      case 270 -> new Matrix(0, -1, 1, 0, llx, lly + h);
      default -> Matrix.getTranslateInstance(llx, lly);
    };
  }

  static int normalizedRotation(int rotation) {
    int r = ((rotation % 360) + 360) % 360;
    // /Rotate must be a multiple of 90; anything else is treated as upright
    return r % 90 == 0 ? r : 0;
  }
}
