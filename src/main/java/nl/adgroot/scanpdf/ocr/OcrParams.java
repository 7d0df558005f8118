package nl.adgroot.scanpdf.ocr;

import org.jetbrains.annotations.Nullable;

/**
 * @param languageCode language(s) to recognize, e.g. {@code "eng"} or {@code "eng+heb"}
 * @param mode         engine-specific mode, {@code null} for the engine default
 */
public record OcrParams(String languageCode, @Nullable String mode) {

  public OcrParams(String languageCode) {
    this(languageCode, null);
  }
}
