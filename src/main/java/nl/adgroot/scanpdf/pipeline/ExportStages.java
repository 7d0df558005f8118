package nl.adgroot.scanpdf.pipeline;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import nl.adgroot.scanpdf.embed.Embedder;
import nl.adgroot.scanpdf.embed.EmbedderFactory;
import nl.adgroot.scanpdf.image.ImageExportFormat;
import nl.adgroot.scanpdf.image.ImageFileFormat;
import nl.adgroot.scanpdf.ocr.OcrContext;
import nl.adgroot.scanpdf.ocr.OcrEngine;
import nl.adgroot.scanpdf.ocr.OcrRequestQueue;
import nl.adgroot.scanpdf.ocr.OcrResult;
import nl.adgroot.scanpdf.pdf.GeneratedDocument;
import nl.adgroot.scanpdf.pdf.PageWriter;
import nl.adgroot.scanpdf.pdf.PdfCompat;
import nl.adgroot.scanpdf.pdf.PdfSources;
import nl.adgroot.scanpdf.pdf.PdfTextProbe;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage functions for one export. Every stage returns its input unchanged once the export
 * is cancelled, so queued work drains without touching the document.
 */
public class ExportStages {

  private static final Logger log = LoggerFactory.getLogger(ExportStages.class);

  private final EmbedderFactory embedders;
  private final GeneratedDocument document;
  private final PdfCompat compat;
  private final ExportProgress progress;
  private final CancelToken cancelToken;

  @Nullable private final OcrEngine ocrEngine;
  private final OcrRequestQueue ocrQueue;
  @Nullable private final OcrContext ocr;
  private final Path tempFolder;

  public ExportStages(EmbedderFactory embedders, GeneratedDocument document, PdfCompat compat,
      ExportProgress progress, @Nullable OcrEngine ocrEngine, OcrRequestQueue ocrQueue,
      @Nullable OcrContext ocr, Path tempFolder) {
    this.embedders = embedders;
    this.document = document;
    this.compat = compat;
    this.progress = progress;
    this.cancelToken = progress.cancelToken();
    this.ocrEngine = ocrEngine;
    this.ocrQueue = ocrQueue;
    this.ocr = ocr;
    this.tempFolder = tempFolder;
  }

  public boolean isOcrEnabled() {
    return ocrEngine != null && ocr != null;
  }

  /** Chooses the embedder. For passthrough pages, rasterizes the source page for OCR. */
  public PageExportState render(PageExportState state) {
    if (skip(state)) return state;
    try {
      state.embedder = embedders.create(state.image());
    } catch (IOException e) {
      throw new UncheckedIOException("Could not load " + state, e);
    }
    return state;
  }

  /** Persists the page image (unless a result is cached) and queues OCR. */
  public PageExportState initOcr(PageExportState state) {
    if (skip(state) || !isOcrEnabled()) return state;
    Embedder embedder = state.embedder;

    Path tempFile = null;
    if (!ocrQueue.hasCachedResult(ocrEngine, state.image(), ocr.params())) {
      String ext = embedder.originalFileFormat() == ImageFileFormat.PNG ? ".png" : ".jpg";
      tempFile = tempFolder.resolve(UUID.randomUUID() + ext);
      try (OutputStream out = Files.newOutputStream(tempFile)) {
        embedder.copyToStream(out);
      } catch (IOException e) {
        deleteQuietly(tempFile);
        throw new UncheckedIOException("Could not write OCR image for " + state, e);
      }
    }
    state.ocrFuture = ocrQueue.enqueue(ocrEngine, state.image(), tempFile, ocr.params(), ocr.priority(), cancelToken);
    return state;
  }

  /**
   * Completes when the OCR result arrives or the export is cancelled, whichever is first.
   * A failed request leaves the page without a text layer.
   */
  public CompletableFuture<PageExportState> waitForOcr(PageExportState state) {
    CompletableFuture<OcrResult> pending = state.ocrFuture;
    if (skip(state) || pending == null) {
      return CompletableFuture.completedFuture(state);
    }
    CompletableFuture<OcrResult> cancelled = cancelToken.whenCancelled().thenApply(v -> null);
    return pending.applyToEither(cancelled, result -> result)
        .handle((result, ex) -> {
          if (ex != null) {
            log.warn("OCR failed for {}, exporting it without text", state, ex);
          } else {
            state.ocrResult = result;
          }
          return state;
        });
  }

  /** Draws the image, then the text layer if there is one. */
  public PageExportState writeToDocument(PageExportState state) {
    if (cancelToken.isCancellationRequested()) return state;
    Embedder embedder = state.embedder;
    OcrResult result = state.ocrResult;

    document.write(doc -> {
      ImageExportFormat format = embedder.prepareForExport(state.image().metadata());
      PageWriter.drawImage(doc, state.page(), embedder, format, state.image().metadata().pageSize(), compat);
      if (result != null) {
        PageWriter.drawOcrText(doc, state.page(), document.ocrLayout(), result, PageWriter.TextLayer.UNDER_IMAGE);
      }
      return null;
    });
    progress.increment();
    return state;
  }

  /** Marks a passthrough page as needing OCR when its source has no extractable text. */
  public PageExportState checkIfOcrNeeded(PageExportState state) {
    if (cancelToken.isCancellationRequested()) return state;
    try {
      state.probeDocument = PdfSources.open(state.image().source());
      state.needsOcr = !PdfTextProbe.hasText(state.probeDocument);
    } catch (IOException | RuntimeException e) {
      log.error("Could not read text of {}, running OCR on it", state, e);
      state.needsOcr = true;
    } finally {
      state.closeProbe();
    }
    return state;
  }

  private boolean skip(PageExportState state) {
    return cancelToken.isCancellationRequested()
        || (state.kind() == PageKind.PASSTHROUGH && !state.needsOcr());
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete {}", file, e);
    }
  }
}
