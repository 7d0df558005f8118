package nl.adgroot.scanpdf.text;

import nl.adgroot.scanpdf.ExportException;

/**
 * The font configured for the invisible text layer cannot be loaded or embedded.
 */
public class NoEmbeddableFontException extends ExportException {

  public NoEmbeddableFontException(String message, Throwable cause) {
    super(message, cause);
  }
}
