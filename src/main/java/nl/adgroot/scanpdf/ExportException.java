package nl.adgroot.scanpdf;

/**
 * The export could not be set up or its output could not be produced.
 */
public class ExportException extends RuntimeException {

  public ExportException(String message) {
    super(message);
  }

  public ExportException(String message, Throwable cause) {
    super(message, cause);
  }
}
