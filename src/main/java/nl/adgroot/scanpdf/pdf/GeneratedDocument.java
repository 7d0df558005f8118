package nl.adgroot.scanpdf.pdf;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.locks.ReentrantLock;
import nl.adgroot.scanpdf.text.OcrFontProvider;
import nl.adgroot.scanpdf.text.OcrTextLayout;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

/**
 * The document built page by page from pixel data. PDFBox documents are not safe for
 * concurrent mutation, so every access goes through {@link #write}.
 */
public final class GeneratedDocument implements Closeable {

  @FunctionalInterface
  public interface DocumentAction<T> {
    T apply(PDDocument doc) throws IOException;
  }

  private final PDDocument doc = new PDDocument();
  private final ReentrantLock lock = new ReentrantLock();
  private final OcrFontProvider fonts;

  // guarded by lock
  private OcrTextLayout ocrLayout;
  private boolean closed;

  private GeneratedDocument(OcrFontProvider fonts) {
    this.fonts = fonts;
  }

  public static GeneratedDocument create(OcrFontProvider fonts) {
    return new GeneratedDocument(fonts);
  }

  /** Appends an empty page; its size is set when the image is drawn. */
  public PDPage addPage() {
    return write(doc -> {
      PDPage page = new PDPage();
      doc.addPage(page);
      return page;
    });
  }

  /**
   * Runs {@code action} while holding the document lock. Keep actions short: other pages
   * wait for the lock.
   */
  public <T> T write(DocumentAction<T> action) {
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("Document is closed");
      }
      return action.apply(doc);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      lock.unlock();
    }
  }

  /** Layout bound to a font loaded into this document. Only call from inside {@link #write}. */
  public OcrTextLayout ocrLayout() throws IOException {
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("ocrLayout() requires the document lock");
    }
    if (ocrLayout == null) {
      ocrLayout = new OcrTextLayout(fonts.load(doc));
    }
    return ocrLayout;
  }

  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (!closed) {
        closed = true;
        doc.close();
      }
    } finally {
      lock.unlock();
    }
  }
}
