package nl.adgroot.scanpdf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import nl.adgroot.scanpdf.image.ImageMetadata;
import nl.adgroot.scanpdf.image.Java2dImageEngine;
import nl.adgroot.scanpdf.image.PageImage;
import nl.adgroot.scanpdf.ocr.DefaultOcrRequestQueue;
import nl.adgroot.scanpdf.ocr.FakeOcrEngine;
import nl.adgroot.scanpdf.ocr.OcrContext;
import nl.adgroot.scanpdf.ocr.OcrEngine;
import nl.adgroot.scanpdf.ocr.OcrPermitPool;
import nl.adgroot.scanpdf.ocr.OcrResult;
import nl.adgroot.scanpdf.ocr.OcrResultElement;
import nl.adgroot.scanpdf.pdf.DocumentMetadata;
import nl.adgroot.scanpdf.pdf.EncryptionParams;
import nl.adgroot.scanpdf.pdf.ExportParams;
import nl.adgroot.scanpdf.pdf.NativePdfLibrary;
import nl.adgroot.scanpdf.pdf.PdfCompat;
import nl.adgroot.scanpdf.pipeline.CancelToken;
import nl.adgroot.scanpdf.pipeline.ExportProgress;
import nl.adgroot.scanpdf.text.OcrFontProvider;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.util.Matrix;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfExporterTest {

  @TempDir
  Path tmp;

  private final ExecutorService workers = Executors.newFixedThreadPool(3);
  private final ExecutorService permitExec = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    workers.shutdownNow();
    permitExec.shutdownNow();
  }

  @Test
  void export_mixedInputs_keepsInputOrder() throws Exception {
    // GIVEN: pdf, jpeg, pdf, pdf, png
    List<PageImage> pages = List.of(
        pdf(TestFiles.pdfWithText(tmp, "a.pdf", "Alpha")),
        image(TestFiles.rgbJpeg(tmp, "b.jpg", 200, 100)),
        PageImage.ofPdfBytes(TestFiles.pdfBytesWithText("Bravo"), ImageMetadata.defaults()),
        pdf(TestFiles.pdfWithText(tmp, "c.pdf", "Charlie")),
        image(TestFiles.png(tmp, "d.png", 120, 160)));
    Path out = tmp.resolve("out.pdf");

    // WHEN
    boolean ok = exporter(null).exportAndWait(out, pages, ExportParams.defaults(), null, ExportProgress.none());

    // THEN
    assertTrue(ok);
    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      assertEquals(5, doc.getNumberOfPages());
      assertTrue(pageText(doc, 1).contains("Alpha"));
      assertTrue(pageText(doc, 2).isBlank());
      assertTrue(pageText(doc, 3).contains("Bravo"));
      assertTrue(pageText(doc, 4).contains("Charlie"));
      assertTrue(pageText(doc, 5).isBlank());

      // passthrough pages keep their own geometry
      assertEquals(PDRectangle.LETTER.getWidth(), doc.getPage(0).getMediaBox().getWidth(), 0.01);
    }
  }

  @Test
  void export_withOcr_addsInvisibleTextToImagePages() throws Exception {
    FakeOcrEngine engine = FakeOcrEngine.recognizing("RECEIPT");
    Path out = tmp.resolve("out.pdf");

    boolean ok = exporter(engine).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "scan.jpg", 300, 300))),
        ExportParams.defaults(), OcrContext.foreground("eng"), ExportProgress.none());

    assertTrue(ok);
    assertEquals(1, engine.calls());
    assertEquals("eng", engine.params().get(0).languageCode());
    assertEquals(List.of(true), engine.fileExisted());
    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      assertTrue(pageText(doc, 1).contains("RECEIPT"));
    }
    // the OCR temp file is gone
    try (Stream<Path> files = Files.list(tmp)) {
      assertEquals(Set.of("scan.jpg", "out.pdf"),
          files.map(p -> p.getFileName().toString()).collect(Collectors.toSet()));
    }
  }

  @Test
  void export_withOcr_onlyRecognizesPdfPagesWithoutText() throws Exception {
    // GIVEN: one PDF page with text, one without
    FakeOcrEngine engine = FakeOcrEngine.recognizing("SCANNED");
    List<PageImage> pages = List.of(
        pdf(TestFiles.pdfWithText(tmp, "text.pdf", "Existing")),
        pdf(TestFiles.blankPdf(tmp, "blank.pdf")));
    Path out = tmp.resolve("out.pdf");

    // WHEN
    boolean ok = exporter(engine).exportAndWait(out, pages, ExportParams.defaults(),
        OcrContext.foreground("eng"), ExportProgress.none());

    // THEN
    assertTrue(ok);
    assertEquals(1, engine.calls());
    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      assertEquals(2, doc.getNumberOfPages());
      String first = pageText(doc, 1);
      assertTrue(first.contains("Existing"));
      assertFalse(first.contains("SCANNED"));
      assertTrue(pageText(doc, 2).contains("SCANNED"));
      assertEquals(PDRectangle.A5.getWidth(), doc.getPage(1).getMediaBox().getWidth(), 0.01);
    }
  }

  @Test
  void export_ocrEngineFails_stillExportsWithoutText() throws Exception {
    Path out = tmp.resolve("out.pdf");

    boolean ok = exporter(FakeOcrEngine.failing()).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "scan.jpg", 100, 100))),
        ExportParams.defaults(), OcrContext.foreground("eng"), ExportProgress.none());

    assertTrue(ok);
    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      assertTrue(pageText(doc, 1).isBlank());
    }
  }

  @Test
  void export_ocrRequestedWithoutEngine_exportsWithoutText() throws Exception {
    Path out = tmp.resolve("out.pdf");

    boolean ok = exporter(null).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "scan.jpg", 100, 100))),
        ExportParams.defaults(), OcrContext.foreground("eng"), ExportProgress.none());

    assertTrue(ok);
    assertTrue(Files.exists(out));
  }

  @Test
  void export_alreadyCancelled_writesNothing() throws Exception {
    CancelToken token = new CancelToken();
    token.cancel();
    Path out = tmp.resolve("out.pdf");

    boolean ok = exporter(null).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "scan.jpg", 100, 100)), pdf(TestFiles.pdfWithText(tmp, "a.pdf", "A"))),
        ExportParams.defaults(), null, new ExportProgress(token, null));

    assertFalse(ok);
    assertFalse(Files.exists(out));
  }

  @Test
  void export_cancelledWhileWaitingForOcr_returnsFalse() throws Exception {
    // GIVEN: an engine that never answers
    FakeOcrEngine engine = FakeOcrEngine.hanging();
    CancelToken token = new CancelToken();
    Path out = tmp.resolve("out.pdf");

    CompletableFuture<Boolean> running = exporter(engine).export(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "scan.jpg", 100, 100))),
        ExportParams.defaults(), OcrContext.foreground("eng"), new ExportProgress(token, null));

    // WHEN: OCR has started, cancel
    long deadline = System.currentTimeMillis() + 5000;
    while (engine.calls() == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(1, engine.calls());
    token.cancel();

    // THEN
    assertFalse(running.get(5, TimeUnit.SECONDS));
    assertFalse(Files.exists(out));
  }

  @Test
  void export_encrypted_withPassthroughPages() throws Exception {
    List<PageImage> pages = List.of(
        image(TestFiles.rgbJpeg(tmp, "a.jpg", 100, 100)),
        pdf(TestFiles.pdfWithText(tmp, "b.pdf", "Secret")),
        image(TestFiles.png(tmp, "c.png", 80, 80)));
    ExportParams params = ExportParams.defaults().withEncryption(EncryptionParams.withPasswords("owner", "user"));
    Path out = tmp.resolve("out.pdf");

    assertTrue(exporter(null).exportAndWait(out, pages, params, null, ExportProgress.none()));

    assertThrows(InvalidPasswordException.class, () -> Loader.loadPDF(out.toFile()).close());
    try (PDDocument doc = Loader.loadPDF(out.toFile(), "user")) {
      assertTrue(doc.isEncrypted());
      assertEquals(3, doc.getNumberOfPages());
      assertTrue(pageText(doc, 2).contains("Secret"));
    }
  }

  @Test
  void export_pdfa1b_writesArchivalMarkers() throws Exception {
    ExportParams params = ExportParams.defaults()
        .withCompat(PdfCompat.PDFA_1B)
        .withMetadata(DocumentMetadata.titled("Archive"));
    Path out = tmp.resolve("out.pdf");

    assertTrue(exporter(null).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "a.jpg", 100, 100))), params, null, ExportProgress.none()));

    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      assertEquals(1.4f, doc.getVersion(), 0.001);
      assertEquals("Archive", doc.getDocumentInformation().getTitle());
      assertEquals(1, doc.getDocumentCatalog().getOutputIntents().size());
      assertNotNull(doc.getDocumentCatalog().getMetadata());
    }
  }

  @Test
  void export_pdfa1b_staysAtVersion14_withoutXrefStreams() throws Exception {
    // GIVEN: a generated page and a passthrough page, so both save paths run
    ExportParams params = ExportParams.defaults().withCompat(PdfCompat.PDFA_1B);
    Path out = tmp.resolve("out.pdf");

    assertTrue(exporter(null).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "a.jpg", 100, 100)), pdf(TestFiles.pdfWithText(tmp, "b.pdf", "B"))),
        params, null, ExportProgress.none()));

    // THEN
    byte[] bytes = Files.readAllBytes(out);
    assertEquals("%PDF-1.4", new String(bytes, 0, 8, StandardCharsets.US_ASCII));
    try (PDDocument doc = Loader.loadPDF(bytes)) {
      assertFalse(doc.getDocument().isXRefStream());
      assertEquals(1.4f, doc.getVersion(), 0.001);
    }
  }

  @Test
  void export_pdfa1b_flattensAlpha() throws Exception {
    Path png = TestFiles.argbPng(tmp, "alpha.png", 40, 40);

    Path archival = tmp.resolve("archival.pdf");
    assertTrue(exporter(null).exportAndWait(archival, List.of(image(png)),
        ExportParams.defaults().withCompat(PdfCompat.PDFA_1B), null, ExportProgress.none()));
    Path plain = tmp.resolve("plain.pdf");
    assertTrue(exporter(null).exportAndWait(plain, List.of(image(png)),
        ExportParams.defaults(), null, ExportProgress.none()));

    try (PDDocument doc = Loader.loadPDF(archival.toFile())) {
      assertFalse(firstImage(doc.getPage(0)).getCOSObject().containsKey(COSName.SMASK));
    }
    try (PDDocument doc = Loader.loadPDF(plain.toFile())) {
      assertTrue(firstImage(doc.getPage(0)).getCOSObject().containsKey(COSName.SMASK));
    }
  }

  @Test
  void export_withOcr_keepsHebrewTextSearchable() throws Exception {
    // GIVEN: a right-to-left word mixing Hebrew and Latin letters
    OcrResult result = new OcrResult(1000, 1000,
        List.of(new OcrResultElement("\u05EAest", new OcrResultElement.Bounds(100, 400, 800, 100), true)));
    FakeOcrEngine engine = new FakeOcrEngine(file -> CompletableFuture.completedFuture(result));
    Path out = tmp.resolve("out.pdf");

    // WHEN
    assertTrue(exporter(engine).exportAndWait(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "scan.jpg", 300, 300))),
        ExportParams.defaults(), OcrContext.foreground("heb"), ExportProgress.none()));

    // THEN
    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      String text = pageText(doc, 1);
      assertTrue(text.contains("\u05EA"), text);
    }
  }

  @Test
  void export_bitmapAtFractionalDpi_imageFillsMediaBox() throws Exception {
    BufferedImage img = TestFiles.image(193, 97, BufferedImage.TYPE_INT_RGB, Color.ORANGE);
    Path out = tmp.resolve("out.pdf");

    assertTrue(exporter(null).exportAndWait(out,
        List.of(PageImage.ofImage(img, 96.5, ImageMetadata.defaults())),
        ExportParams.defaults(), null, ExportProgress.none()));

    try (PDDocument doc = Loader.loadPDF(out.toFile())) {
      PDPage page = doc.getPage(0);
      ImageMatrixCollector collector = new ImageMatrixCollector();
      collector.processPage(page);

      assertEquals(1, collector.matrices.size());
      Matrix ctm = collector.matrices.get(0);
      PDRectangle mediaBox = page.getMediaBox();
      assertEquals(193 * 72 / 96.5, mediaBox.getWidth(), 0.01);
      assertEquals(mediaBox.getWidth(), ctm.getScaleX(), 0.001);
      assertEquals(mediaBox.getHeight(), ctm.getScaleY(), 0.001);
      assertEquals(0, ctm.getTranslateX(), 0.001);
      assertEquals(0, ctm.getTranslateY(), 0.001);
    }
  }

  @Test
  void export_toStream_leavesStreamOpen() throws Exception {
    AtomicInteger closes = new AtomicInteger();
    ByteArrayOutputStream out = new ByteArrayOutputStream() {
      @Override
      public void close() {
        closes.incrementAndGet();
      }
    };

    boolean ok = exporter(null).export(out,
        List.of(image(TestFiles.rgbJpeg(tmp, "a.jpg", 100, 100)), pdf(TestFiles.pdfWithText(tmp, "b.pdf", "B"))),
        ExportParams.defaults(), null, ExportProgress.none()).get(30, TimeUnit.SECONDS);

    assertTrue(ok);
    assertEquals(0, closes.get());
    try (PDDocument doc = Loader.loadPDF(out.toByteArray())) {
      assertEquals(2, doc.getNumberOfPages());
    }
  }

  @Test
  void export_reportsProgressForEveryPage() throws Exception {
    List<Integer> seen = new ArrayList<>();
    ExportProgress progress = ExportProgress.withListener((done, total) -> {
      synchronized (seen) {
        seen.add(done);
      }
      assertEquals(3, total);
    });

    assertTrue(exporter(null).exportAndWait(tmp.resolve("out.pdf"),
        List.of(
            image(TestFiles.rgbJpeg(tmp, "a.jpg", 50, 50)),
            pdf(TestFiles.pdfWithText(tmp, "b.pdf", "B")),
            image(TestFiles.png(tmp, "c.png", 50, 50))),
        ExportParams.defaults(), null, progress));

    assertEquals(3, progress.done());
    // workers may report out of order
    List<Integer> sorted = new ArrayList<>(seen);
    Collections.sort(sorted);
    assertEquals(List.of(0, 1, 2, 3), sorted);
  }

  private PdfExporter exporter(OcrEngine engine) {
    return new PdfExporter(
        new Java2dImageEngine(72, 0.75f, 128),
        0.75f,
        engine,
        new DefaultOcrRequestQueue(new OcrPermitPool(2, true), permitExec, 100),
        OcrFontProvider.bundled(),
        NativePdfLibrary.instance(),
        workers,
        tmp);
  }

  private static PageImage image(Path file) {
    return PageImage.ofFile(file, ImageMetadata.defaults());
  }

  private static PageImage pdf(Path file) {
    return PageImage.ofFile(file, ImageMetadata.defaults());
  }

  private static PDImageXObject firstImage(PDPage page) throws Exception {
    PDResources resources = page.getResources();
    for (COSName name : resources.getXObjectNames()) {
      if (resources.getXObject(name) instanceof PDImageXObject image) {
        return image;
      }
    }
    throw new AssertionError("page has no image");
  }

  /** Records the transformation matrix in effect at every {@code Do}. */
  private static class ImageMatrixCollector extends PDFStreamEngine {

    final List<Matrix> matrices = new ArrayList<>();

    ImageMatrixCollector() {
      addOperator(new Concatenate(this));
      addOperator(new Save(this));
      addOperator(new Restore(this));
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
      if (OperatorName.DRAW_OBJECT.equals(operator.getName())) {
        matrices.add(getGraphicsState().getCurrentTransformationMatrix().clone());
      }
      super.processOperator(operator, operands);
    }
  }

  private static String pageText(PDDocument doc, int page) throws Exception {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setStartPage(page);
    stripper.setEndPage(page);
    return stripper.getText(doc);
  }
}
