package nl.adgroot.scanpdf.ocr;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

public interface OcrEngine {

  /** Stable identity used to key cached results. */
  String id();

  /** Recognizes text in an image file. The file is only read, never deleted. */
  CompletableFuture<OcrResult> process(Path imageFile, OcrParams params);
}
