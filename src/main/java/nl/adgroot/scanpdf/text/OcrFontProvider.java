package nl.adgroot.scanpdf.text;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.jetbrains.annotations.Nullable;

/**
 * Font used to lay out and draw the invisible text layer. Always a TrueType font embedded
 * as a Unicode (Type 0) subset, so any script the font covers stays searchable.
 */
public final class OcrFontProvider {

  // covers Latin, Greek, Cyrillic, Hebrew and Arabic
  static final String BUNDLED_FONT = "/fonts/DejaVuSans.ttf";

  @Nullable
  private final Path fontFile;
  private final byte[] fontBytes;

  private OcrFontProvider(@Nullable Path fontFile, byte[] fontBytes) {
    this.fontFile = fontFile;
    this.fontBytes = fontBytes;
  }

  /**
   * DejaVu Sans, shipped with the application.
   *
   * @throws NoEmbeddableFontException if the font is missing from the classpath
   */
  public static OcrFontProvider bundled() {
    try (InputStream in = OcrFontProvider.class.getResourceAsStream(BUNDLED_FONT)) {
      if (in == null) {
        throw new NoEmbeddableFontException("Bundled font not on the classpath: " + BUNDLED_FONT, null);
      }
      return validated(null, in.readAllBytes(), BUNDLED_FONT);
    } catch (IOException e) {
      throw new NoEmbeddableFontException("Bundled font cannot be read: " + BUNDLED_FONT, e);
    }
  }

  /**
   * A TrueType font from disk. The file is parsed once here so a bad path fails before any
   * export starts.
   *
   * @throws NoEmbeddableFontException if the file is missing or not a usable TrueType font
   */
  public static OcrFontProvider fromFile(Path fontFile) {
    if (!Files.isRegularFile(fontFile)) {
      throw new NoEmbeddableFontException("Font file not found: " + fontFile, null);
    }
    try {
      return validated(fontFile, Files.readAllBytes(fontFile), fontFile.toString());
    } catch (IOException e) {
      throw new NoEmbeddableFontException("Font file cannot be read: " + fontFile, e);
    }
  }

  /** Blank path -> {@link #bundled()}. */
  public static OcrFontProvider fromConfig(@Nullable String fontPath) {
    if (fontPath == null || fontPath.isBlank()) {
      return bundled();
    }
    return fromFile(Path.of(fontPath));
  }

  private static OcrFontProvider validated(@Nullable Path fontFile, byte[] bytes, String name) {
    try (PDDocument scratch = new PDDocument()) {
      PDType0Font.load(scratch, new ByteArrayInputStream(bytes));
    } catch (IOException | RuntimeException e) {
      throw new NoEmbeddableFontException("Font cannot be embedded: " + name, e);
    }
    return new OcrFontProvider(fontFile, bytes);
  }

  /** Loads the font into {@code doc}. Call once per document. */
  public PDFont load(PDDocument doc) throws IOException {
    return PDType0Font.load(doc, new ByteArrayInputStream(fontBytes));
  }

  @Override
  public String toString() {
    return fontFile == null ? "DejaVu Sans (bundled)" : fontFile.toString();
  }
}
