package nl.adgroot.scanpdf.pipeline;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import nl.adgroot.scanpdf.embed.Embedder;
import nl.adgroot.scanpdf.image.PageImage;
import nl.adgroot.scanpdf.ocr.OcrResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Working record of one page while it moves through the pipeline. Only the stage currently
 * processing the page touches it.
 */
public final class PageExportState implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(PageExportState.class);

  private final int index;
  private final PageImage image;
  private final PageKind kind;
  private final PDPage page;

  @Nullable Embedder embedder;
  @Nullable CompletableFuture<OcrResult> ocrFuture;
  @Nullable OcrResult ocrResult;
  @Nullable PDDocument probeDocument;
  boolean needsOcr;

  private boolean closed;

  public PageExportState(PageClassifier.ClassifiedPage classified, PDPage page) {
    this.index = classified.index();
    this.image = classified.image();
    this.kind = classified.kind();
    this.page = page;
  }

  public int index() {
    return index;
  }

  public PageImage image() {
    return image;
  }

  public PageKind kind() {
    return kind;
  }

  /** Placeholder page in the generated document. */
  public PDPage page() {
    return page;
  }

  @Nullable
  public Embedder embedder() {
    return embedder;
  }

  @Nullable
  public OcrResult ocrResult() {
    return ocrResult;
  }

  public boolean needsOcr() {
    return needsOcr;
  }

  void closeProbe() {
    if (probeDocument != null) {
      try {
        probeDocument.close();
      } catch (IOException e) {
        log.warn("Could not close probe document of page {}", index + 1, e);
      }
      probeDocument = null;
    }
  }

  /** Releases the embedder and probe document. Safe to call more than once. */
  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    if (embedder != null) {
      embedder.close();
      embedder = null;
    }
    closeProbe();
  }

  @Override
  public String toString() {
    return "page " + (index + 1) + " (" + kind + ")";
  }
}
