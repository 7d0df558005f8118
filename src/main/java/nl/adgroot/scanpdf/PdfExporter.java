package nl.adgroot.scanpdf;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import nl.adgroot.scanpdf.config.ExportConfig;
import nl.adgroot.scanpdf.embed.EmbedderFactory;
import nl.adgroot.scanpdf.image.ImageEngine;
import nl.adgroot.scanpdf.image.Java2dImageEngine;
import nl.adgroot.scanpdf.image.PageImage;
import nl.adgroot.scanpdf.ocr.DefaultOcrRequestQueue;
import nl.adgroot.scanpdf.ocr.HttpOcrEngine;
import nl.adgroot.scanpdf.ocr.OcrContext;
import nl.adgroot.scanpdf.ocr.OcrEngine;
import nl.adgroot.scanpdf.ocr.OcrPermitPool;
import nl.adgroot.scanpdf.ocr.OcrRequestQueue;
import nl.adgroot.scanpdf.pdf.DocumentFinalizer;
import nl.adgroot.scanpdf.pdf.ExportParams;
import nl.adgroot.scanpdf.pdf.GeneratedDocument;
import nl.adgroot.scanpdf.pdf.NativePdfLibrary;
import nl.adgroot.scanpdf.pdf.OutputTarget;
import nl.adgroot.scanpdf.pdf.PassthroughMerger;
import nl.adgroot.scanpdf.pipeline.CancelToken;
import nl.adgroot.scanpdf.pipeline.ExportProgress;
import nl.adgroot.scanpdf.pipeline.ExportStages;
import nl.adgroot.scanpdf.pipeline.PageClassifier;
import nl.adgroot.scanpdf.pipeline.PageExportState;
import nl.adgroot.scanpdf.pipeline.PagePipeline;
import nl.adgroot.scanpdf.text.OcrFontProvider;
import org.apache.pdfbox.pdmodel.PDPage;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports page images to one PDF. Pixel pages are drawn into a generated document while
 * PDF pages are checked for text in parallel; PDF pages are then swapped in at their
 * original positions.
 */
public class PdfExporter {

  private static final Logger log = LoggerFactory.getLogger(PdfExporter.class);

  private final EmbedderFactory embedders;
  @Nullable private final OcrEngine ocrEngine;
  private final OcrRequestQueue ocrQueue;
  private final OcrFontProvider fonts;
  private final PassthroughMerger merger;
  private final Executor workers;
  private final Path tempFolder;

  public PdfExporter(ImageEngine imageEngine, float jpegQuality, @Nullable OcrEngine ocrEngine,
      OcrRequestQueue ocrQueue, OcrFontProvider fonts, NativePdfLibrary nativeLibrary,
      Executor workers, Path tempFolder) {
    this.embedders = new EmbedderFactory(imageEngine, jpegQuality);
    this.ocrEngine = ocrEngine;
    this.ocrQueue = ocrQueue;
    this.fonts = fonts;
    this.merger = new PassthroughMerger(nativeLibrary, fonts);
    this.workers = workers;
    this.tempFolder = tempFolder;
  }

  /**
   * Wires the default collaborators from configuration.
   *
   * @throws nl.adgroot.scanpdf.text.NoEmbeddableFontException if the configured OCR font is unusable
   */
  public static PdfExporter create(ExportConfig cfg, ExportExecutors executors) {
    OcrEngine engine = cfg.ocr.enabled ? new HttpOcrEngine(cfg.ocr) : null;
    OcrRequestQueue queue = new DefaultOcrRequestQueue(
        new OcrPermitPool(cfg.ocr.concurrency, true), executors.permitPoolExecutor(), cfg.ocr.cacheSize);
    return new PdfExporter(
        new Java2dImageEngine(cfg.render),
        cfg.render.jpegQuality,
        engine,
        queue,
        OcrFontProvider.fromConfig(cfg.ocr.fontPath),
        NativePdfLibrary.instance(),
        executors.workerPool(),
        Path.of(cfg.workers.tempFolder));
  }

  public CompletableFuture<Boolean> export(Path output, List<PageImage> images, ExportParams params,
      @Nullable OcrContext ocr, ExportProgress progress) {
    return export(OutputTarget.of(output), images, params, ocr, progress);
  }

  public CompletableFuture<Boolean> export(OutputStream output, List<PageImage> images, ExportParams params,
      @Nullable OcrContext ocr, ExportProgress progress) {
    return export(OutputTarget.of(output), images, params, ocr, progress);
  }

  /**
   * Blocking variant of {@link #export(Path, List, ExportParams, OcrContext, ExportProgress)}.
   *
   * @return false if the export was cancelled
   */
  public boolean exportAndWait(Path output, List<PageImage> images, ExportParams params,
      @Nullable OcrContext ocr, ExportProgress progress) throws IOException, InterruptedException {
    try {
      return export(output, images, params, ocr, progress).get();
    } catch (ExecutionException e) {
      throw unwrap(e.getCause());
    }
  }

  CompletableFuture<Boolean> export(OutputTarget output, List<PageImage> images, ExportParams params,
      @Nullable OcrContext ocr, ExportProgress progress) {

    progress.start(images.size());
    CancelToken cancelToken = progress.cancelToken();

    if (ocr != null && ocrEngine == null) {
      log.error("OCR requested ({}) but no OCR engine is available; exporting without text layer",
          ocr.params().languageCode());
      ocr = null;
    }

    GeneratedDocument document = GeneratedDocument.create(fonts);
    PageClassifier.Classification classified = PageClassifier.classify(images);

    // one placeholder per input page so page indices line up with the input
    List<PDPage> placeholders = new ArrayList<>(images.size());
    for (int i = 0; i < images.size(); i++) {
      placeholders.add(document.addPage());
    }
    List<PageExportState> renderStates = new ArrayList<>();
    for (PageClassifier.ClassifiedPage page : classified.toRender()) {
      renderStates.add(new PageExportState(page, placeholders.get(page.index())));
    }
    List<PageExportState> passthroughStates = new ArrayList<>();
    for (PageClassifier.ClassifiedPage page : classified.passthrough()) {
      passthroughStates.add(new PageExportState(page, placeholders.get(page.index())));
    }
    log.info("Exporting {} page(s) to {}: {} rendered, {} passthrough, ocr={}",
        images.size(), output, renderStates.size(), passthroughStates.size(),
        ocr == null ? "off" : ocr.params().languageCode());

    ExportStages stages = new ExportStages(embedders, document, params.compat(), progress,
        ocrEngine, ocrQueue, ocr, tempFolder);

    PagePipeline<PageExportState> renderPipeline = PagePipeline.forItems(renderStates).step(stages::render);
    if (stages.isOcrEnabled()) {
      renderPipeline.step(stages::initOcr).asyncStep(stages::waitForOcr);
    }
    renderPipeline.step(stages::writeToDocument);
    CompletableFuture<List<PageExportState>> rendered = renderPipeline.run(workers);

    CompletableFuture<List<PageExportState>> probed = stages.isOcrEnabled()
        ? PagePipeline.forItems(passthroughStates)
            .step(stages::checkIfOcrNeeded)
            .step(stages::render)
            .step(stages::initOcr)
            .asyncStep(stages::waitForOcr)
            .run(workers)
        : CompletableFuture.completedFuture(passthroughStates);

    return CompletableFuture.allOf(rendered, probed)
        .thenApplyAsync(v -> {
          if (cancelToken.isCancellationRequested()) return false;

          byte[] buffer = DocumentFinalizer.finish(document, params);
          if (cancelToken.isCancellationRequested()) return false;

          List<PassthroughMerger.Page> pages = new ArrayList<>(passthroughStates.size());
          for (PageExportState state : passthroughStates) {
            pages.add(new PassthroughMerger.Page(state.index(), state.image().source(), state.ocrResult()));
          }
          try {
            return merger.merge(buffer, output, pages, params, progress);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        }, workers)
        .whenComplete((ok, ex) -> {
          cleanup(renderStates, passthroughStates, document);
          if (ex != null) {
            log.error("Export to {} failed", output, ex);
          } else if (!ok) {
            log.info("Export to {} cancelled", output);
          }
        });
  }

  private static void cleanup(List<PageExportState> renderStates, List<PageExportState> passthroughStates,
      GeneratedDocument document) {
    renderStates.forEach(PageExportState::close);
    passthroughStates.forEach(PageExportState::close);
    try {
      document.close();
    } catch (IOException e) {
      log.warn("Could not close generated document", e);
    }
  }

  static IOException unwrap(Throwable t) {
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    if (t instanceof UncheckedIOException u) {
      return u.getCause();
    }
    if (t instanceof IOException io) {
      return io;
    }
    if (t instanceof RuntimeException r) {
      throw r;
    }
    if (t instanceof Error err) {
      throw err;
    }
    return new IOException(t);
  }
}
