package nl.adgroot.scanpdf.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import nl.adgroot.scanpdf.ocr.OcrResult;
import nl.adgroot.scanpdf.ocr.OcrResultElement;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OcrTextLayoutTest {

  private PDDocument doc;
  private OcrTextLayout layout;

  @BeforeEach
  void setUp() throws Exception {
    doc = new PDDocument();
    // Standard 14 metrics are fixed, which keeps the sizing arithmetic below exact
    layout = new OcrTextLayout(new PDType1Font(Standard14Fonts.FontName.TIMES_ROMAN));
  }

  @AfterEach
  void tearDown() throws Exception {
    doc.close();
  }

  @Test
  void layout_sizesFontToFillBoxWidth() {
    // Times-Roman "Hello" is 2.222 em wide: 20pt guess -> 44.44pt, scaled to 100pt -> 45
    TextDrawInfo info = layout.layout(new OcrResultElement("Hello", 0, 0, 100, 20), 1f, 1f);

    assertNotNull(info);
    assertEquals(45, info.fontSize());
    assertEquals("Hello", info.text());
    assertTrue(info.textWidth() <= 100f);
  }

  @Test
  void layout_centersTextInBox() {
    TextDrawInfo info = layout.layout(new OcrResultElement("Hello", 10, 30, 100, 20), 1f, 1f);

    assertNotNull(info);
    float slackX = 100f - info.textWidth();
    float slackY = 20f - info.textHeight();
    assertEquals(10f + slackX / 2, info.x(), 1e-4);
    assertEquals(30f + slackY / 2, info.y(), 1e-4);
  }

  @Test
  void layout_rescalesBoundsFromOcrPixelsToPage() {
    OcrResult result = new OcrResult(2000, 1000, List.of(new OcrResultElement("Hello", 200, 100, 200, 40)));

    List<TextDrawInfo> infos = layout.layout(result, 1000f, 500f);

    assertEquals(1, infos.size());
    assertEquals(100f, infos.get(0).width(), 1e-4);
    assertEquals(20f, infos.get(0).height(), 1e-4);
    assertEquals(45, infos.get(0).fontSize());
  }

  @Test
  void layout_dropsHugeDash() {
    OcrResultElement dash = new OcrResultElement("-", 0, 0, 1000, 50);

    assertNull(layout.layout(dash, 1f, 1f));
  }

  @Test
  void layout_dropsHugeUnderscore() {
    OcrResultElement underscore = new OcrResultElement("_", 0, 0, 2000, 50);

    assertNull(layout.layout(underscore, 1f, 1f));
  }

  @Test
  void layout_keepsSmallDash() {
    TextDrawInfo info = layout.layout(new OcrResultElement("-", 0, 0, 10, 20), 1f, 1f);

    assertNotNull(info);
    assertTrue(info.fontSize() <= 100);
  }

  @Test
  void layout_keepsLargeWords() {
    TextDrawInfo info = layout.layout(new OcrResultElement("TITLE", 0, 0, 2000, 200), 1f, 1f);

    assertNotNull(info);
    assertTrue(info.fontSize() > 100);
  }

  @Test
  void layout_skipsEmptyText() {
    assertNull(layout.layout(new OcrResultElement("", 0, 0, 10, 10), 1f, 1f));
  }

  @Test
  void layout_rightToLeft_reversesText() {
    OcrResultElement rtl = new OcrResultElement("abc", new OcrResultElement.Bounds(0, 0, 50, 10), true);

    TextDrawInfo info = layout.layout(rtl, 1f, 1f);

    assertNotNull(info);
    assertEquals("cba", info.text());
  }

  @Test
  void layout_fontWithoutGlyphs_skipsElement() {
    // Times-Roman cannot encode Hebrew
    OcrResult result = new OcrResult(100, 100, List.of(
        new OcrResultElement("שלום", new OcrResultElement.Bounds(0, 0, 50, 10), true),
        new OcrResultElement("ok", 0, 20, 50, 10)));

    List<TextDrawInfo> infos = layout.layout(result, 100f, 100f);

    assertEquals(1, infos.size());
    assertEquals("ok", infos.get(0).text());
  }

  @Test
  void fromFile_missingFont_isFatal(@TempDir Path tmp) {
    assertThrows(NoEmbeddableFontException.class, () -> OcrFontProvider.fromFile(tmp.resolve("missing.ttf")));
  }

  @Test
  void fromFile_notAFont_isFatal(@TempDir Path tmp) throws Exception {
    Path bogus = Files.writeString(tmp.resolve("bogus.ttf"), "not a font");

    assertThrows(NoEmbeddableFontException.class, () -> OcrFontProvider.fromFile(bogus));
  }

  @Test
  void fromConfig_blankPath_usesBundledFont() {
    assertEquals("DejaVu Sans (bundled)", OcrFontProvider.fromConfig("  ").toString());
  }

  @Test
  void bundledFont_laysOutHebrewRightToLeft() throws Exception {
    OcrTextLayout unicode = new OcrTextLayout(OcrFontProvider.bundled().load(doc));
    OcrResult result = new OcrResult(100, 100, List.of(
        new OcrResultElement("\u05EAest", new OcrResultElement.Bounds(0, 0, 50, 10), true),
        new OcrResultElement("\u0416\u0443\u043A", 0, 20, 50, 10)));

    List<TextDrawInfo> infos = unicode.layout(result, 100f, 100f);

    assertEquals(2, infos.size());
    assertEquals("tse\u05EA", infos.get(0).text());
    assertTrue(infos.get(0).fontSize() > 1);
  }

  @Test
  void fromFile_loadsTrueTypeFont(@TempDir Path tmp) throws Exception {
    Path copy = tmp.resolve("font.ttf");
    try (InputStream in = OcrFontProvider.class.getResourceAsStream(OcrFontProvider.BUNDLED_FONT)) {
      Files.copy(in, copy);
    }

    OcrFontProvider provider = OcrFontProvider.fromFile(copy);

    assertEquals(copy.toString(), provider.toString());
    assertNotNull(provider.load(doc));
  }
}
