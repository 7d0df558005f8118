package nl.adgroot.scanpdf.pdf;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jetbrains.annotations.Nullable;

/**
 * Object-level editing of serialized documents. One merge at a time per process:
 * callers run their whole merge inside {@link #exclusive}.
 */
public final class NativePdfLibrary {

  @FunctionalInterface
  public interface Session<T> {
    T run(NativePdfLibrary library) throws IOException;
  }

  private static final NativePdfLibrary INSTANCE = new NativePdfLibrary();

  private final ReentrantLock lock = new ReentrantLock();

  private NativePdfLibrary() {}

  public static NativePdfLibrary instance() {
    return INSTANCE;
  }

  public <T> T exclusive(Session<T> session) throws IOException {
    lock.lock();
    try {
      return session.run(this);
    } finally {
      lock.unlock();
    }
  }

  /** Opens a serialized document for editing. Requires {@link #exclusive}. */
  public PDDocument load(byte[] buffer, @Nullable String password) throws IOException {
    requireLock();
    return password == null ? Loader.loadPDF(buffer) : Loader.loadPDF(buffer, password);
  }

  private void requireLock() {
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("NativePdfLibrary used outside exclusive()");
    }
  }
}
