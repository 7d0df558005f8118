package nl.adgroot.scanpdf.pipeline;

public enum PageKind {
  /** Pixels are drawn into the generated document. */
  TO_RENDER,
  /** The source PDF page is imported as-is. */
  PASSTHROUGH
}
