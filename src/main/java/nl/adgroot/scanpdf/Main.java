package nl.adgroot.scanpdf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import nl.adgroot.scanpdf.config.ConfigLoader;
import nl.adgroot.scanpdf.config.ExportConfig;
import nl.adgroot.scanpdf.image.ImageMetadata;
import nl.adgroot.scanpdf.image.PageImage;
import nl.adgroot.scanpdf.ocr.OcrContext;
import nl.adgroot.scanpdf.pdf.DocumentMetadata;
import nl.adgroot.scanpdf.pdf.EncryptionParams;
import nl.adgroot.scanpdf.pdf.ExportParams;
import nl.adgroot.scanpdf.pdf.PdfCompat;
import nl.adgroot.scanpdf.pdf.PdfPageSplitter;
import nl.adgroot.scanpdf.pipeline.CancelToken;
import nl.adgroot.scanpdf.pipeline.ExportProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "scan-pdf-export",
    mixinStandardHelpOptions = true,
    description = "Combine JPEG, PNG and PDF pages into one PDF, optionally searchable, encrypted or PDF/A"
)
public class Main implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  @Parameters(arity = "1..*", description = "Input pages: JPEG, PNG or PDF files, in output order")
  private List<Path> inputs;

  @Option(names = {"-o", "--output"}, required = true, description = "Output PDF file")
  private Path output;

  @Option(names = {"--config"}, description = "JSON config file (default: bundled config.json)")
  private Path configFile;

  @Option(names = {"--ocr"}, description = "OCR language code, e.g. eng; omit to skip OCR")
  private String ocrLanguage;

  @Option(names = {"--pdfa"}, description = "Compatibility: DEFAULT, PDFA_1B, PDFA_2B, PDFA_3B, PDFA_3U",
      defaultValue = "DEFAULT")
  private String compat;

  @Option(names = {"--owner-password"}, description = "Owner password (enables encryption)")
  private String ownerPassword;

  @Option(names = {"--user-password"}, description = "User password (enables encryption)")
  private String userPassword;

  @Option(names = {"--title"}, description = "Document title")
  private String title;

  @Option(names = {"--author"}, description = "Document author")
  private String author;

  @Option(names = {"--subject"}, description = "Document subject")
  private String subject;

  @Option(names = {"--keywords"}, description = "Document keywords")
  private String keywords;

  public static void main(String[] args) {
    System.exit(new CommandLine(new Main()).execute(args));
  }

  @Override
  public Integer call() throws Exception {
    ExportConfig cfg = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.loadDefault();

    List<PageImage> pages = loadPages(inputs);
    ExportParams params = exportParams();
    OcrContext ocr = ocrLanguage == null || ocrLanguage.isBlank() ? null : OcrContext.foreground(ocrLanguage);

    CancelToken cancelToken = new CancelToken();
    ExportProgress reporting = new ExportProgress(cancelToken, (done, total) -> {
      if (done > 0) System.out.println(progressLine(done, total));
    });
    Runtime.getRuntime().addShutdownHook(new Thread(cancelToken::cancel, "export-cancel"));

    try (ExportExecutors exec = ExportExecutors.create(cfg)) {
      PdfExporter exporter = PdfExporter.create(cfg, exec);
      boolean ok = exporter.exportAndWait(output, pages, params, ocr, reporting);
      if (!ok) {
        System.err.println("Export cancelled, nothing written");
        return 2;
      }
      System.out.println("Wrote " + pages.size() + " page(s) to " + output + " | " + reporting.formatStatus());
      return 0;
    }
  }

  private static String progressLine(int done, int total) {
    return String.format("Page %d/%d", done, total);
  }

  private ExportParams exportParams() {
    EncryptionParams encryption = ownerPassword != null || userPassword != null
        ? EncryptionParams.withPasswords(ownerPassword, userPassword)
        : EncryptionParams.none();
    DocumentMetadata metadata = new DocumentMetadata(title, author, keywords, subject, null);
    return new ExportParams(PdfCompat.parse(compat), encryption, metadata);
  }

  /** Multi-page PDFs become one passthrough page per PDF page. */
  static List<PageImage> loadPages(List<Path> inputs) throws IOException {
    PdfPageSplitter splitter = new PdfPageSplitter();
    List<PageImage> pages = new ArrayList<>();
    for (Path input : inputs) {
      if (!Files.isRegularFile(input)) {
        throw new ExportException("Input not found: " + input);
      }
      boolean pdf = input.getFileName().toString().toLowerCase().endsWith(".pdf");
      if (pdf && splitter.pageCount(input) > 1) {
        for (byte[] page : splitter.splitToPages(input)) {
          pages.add(PageImage.ofPdfBytes(page, ImageMetadata.defaults()));
        }
      } else {
        pages.add(PageImage.ofFile(input, ImageMetadata.defaults()));
      }
      log.debug("Loaded {} ({} page(s) so far)", input, pages.size());
    }
    return pages;
  }
}
