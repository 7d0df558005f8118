package nl.adgroot.scanpdf.pdf;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Where the finished document goes: a file path or a caller-owned stream.
 */
public abstract class OutputTarget {

  public static OutputTarget of(Path path) {
    return new FileTarget(path);
  }

  /** The stream is written to but never closed. */
  public static OutputTarget of(OutputStream out) {
    return new StreamTarget(out);
  }

  public abstract void write(byte[] pdf) throws IOException;

  public abstract void save(PDDocument doc, CompressParameters compression) throws IOException;

  /**
   * Writes to a temporary sibling and moves it into place, so the path only ever holds
   * a complete document.
   */
  static final class FileTarget extends OutputTarget {

    private final Path path;

    FileTarget(Path path) {
      this.path = path.toAbsolutePath();
    }

    @Override
    public void write(byte[] pdf) throws IOException {
      commit(tmp -> Files.write(tmp, pdf));
    }

    @Override
    public void save(PDDocument doc, CompressParameters compression) throws IOException {
      commit(tmp -> doc.save(tmp.toFile(), compression));
    }

    private interface TempWriter {
      void writeTo(Path tmp) throws IOException;
    }

    private void commit(TempWriter writer) throws IOException {
      Path dir = path.getParent();
      Files.createDirectories(dir);
      Path tmp = Files.createTempFile(dir, "." + path.getFileName(), ".tmp");
      try {
        writer.writeTo(tmp);
        try {
          Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
    }

    @Override
    public String toString() {
      return path.toString();
    }
  }

  static final class StreamTarget extends OutputTarget {

    private final OutputStream out;

    StreamTarget(OutputStream out) {
      this.out = out;
    }

    @Override
    public void write(byte[] pdf) throws IOException {
      out.write(pdf);
      out.flush();
    }

    @Override
    public void save(PDDocument doc, CompressParameters compression) throws IOException {
      // PDDocument.save closes the stream it is given
      doc.save(new FilterOutputStream(out) {
        @Override
        public void write(byte[] b, int off, int len) throws IOException {
          out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
          flush();
        }
      }, compression);
    }

    @Override
    public String toString() {
      return "stream";
    }
  }
}
