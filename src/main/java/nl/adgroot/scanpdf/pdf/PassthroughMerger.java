package nl.adgroot.scanpdf.pdf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import nl.adgroot.scanpdf.image.PageSource;
import nl.adgroot.scanpdf.ocr.OcrResult;
import nl.adgroot.scanpdf.pipeline.ExportProgress;
import nl.adgroot.scanpdf.text.OcrFontProvider;
import nl.adgroot.scanpdf.text.OcrTextLayout;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageTree;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces placeholder pages of a serialized document with the original pages of their
 * source PDFs, then writes the result.
 */
public class PassthroughMerger {

  private static final Logger log = LoggerFactory.getLogger(PassthroughMerger.class);

  /** One slot to fill: the placeholder at {@code index} becomes page 1 of {@code source}. */
  public record Page(int index, PageSource source, @Nullable OcrResult ocrResult) {}

  private final NativePdfLibrary library;
  private final OcrFontProvider fonts;

  public PassthroughMerger(NativePdfLibrary library, OcrFontProvider fonts) {
    this.library = library;
    this.fonts = fonts;
  }

  /**
   * @return false if cancelled part-way; nothing is written in that case
   */
  public boolean merge(byte[] buffer, OutputTarget output, List<Page> pages, ExportParams params,
      ExportProgress progress) throws IOException {

    if (pages.isEmpty()) {
      output.write(buffer);
      return true;
    }

    List<Page> ordered = new ArrayList<>(pages);
    ordered.sort(Comparator.comparingInt(Page::index));

    EncryptionParams encryption = params.encryption();
    String password = encryption.isEffective() ? encryption.editPassword() : null;

    return library.exclusive(lib -> {
      // imported pages share resources with their source, so sources stay open until saved
      List<PDDocument> sources = new ArrayList<>();
      try (PDDocument dest = lib.load(buffer, password)) {
        OcrTextLayout layout = null;

        for (Page page : ordered) {
          PDDocument source = PdfSources.open(page.source());
          sources.add(source);

          PDPage imported = replacePage(dest, page.index(), source.getPage(0));

          if (page.ocrResult() != null) {
            if (layout == null) {
              layout = new OcrTextLayout(fonts.load(dest));
            }
            PageWriter.drawOcrText(dest, imported, layout, page.ocrResult(), PageWriter.TextLayer.OVERLAY);
          }
          progress.increment();

          if (progress.cancelToken().isCancellationRequested()) {
            log.info("Merge cancelled after page {}", page.index() + 1);
            return false;
          }
        }

        if (encryption.isEffective()) {
          // a loaded encrypted document can only be saved again with a protection policy
          dest.protect(encryption.toProtectionPolicy());
        }
        output.save(dest, params.compat().compressParameters());
        log.debug("Merged {} passthrough page(s) into {}", ordered.size(), output);
        return true;
      } finally {
        for (PDDocument source : sources) {
          source.close();
        }
      }
    });
  }

  static PDPage replacePage(PDDocument dest, int index, PDPage sourcePage) throws IOException {
    dest.removePage(index);
    PDPage imported = dest.importPage(sourcePage);

    // importPage appends; move it into the freed slot
    PDPageTree tree = dest.getPages();
    if (index < tree.getCount() - 1) {
      tree.remove(imported);
      tree.insertBefore(imported, tree.get(index));
    }
    return imported;
  }
}
