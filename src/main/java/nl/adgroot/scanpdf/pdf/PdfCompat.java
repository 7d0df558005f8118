package nl.adgroot.scanpdf.pdf;

import org.apache.pdfbox.pdfwriter.compress.CompressParameters;

/**
 * Output compatibility mode. Everything except {@link #DEFAULT} is an archival (PDF/A) profile.
 */
public enum PdfCompat {
  DEFAULT(0, null, 1.7f),
  // PDF/A-1 is based on PDF 1.4
  PDFA_1B(1, "B", 1.4f),
  PDFA_2B(2, "B", 1.7f),
  PDFA_3B(3, "B", 1.7f),
  PDFA_3U(3, "U", 1.7f);

  private final int part;
  private final String conformance;
  private final float pdfVersion;

  PdfCompat(int part, String conformance, float pdfVersion) {
    this.part = part;
    this.conformance = conformance;
    this.pdfVersion = pdfVersion;
  }

  public int part() {
    return part;
  }

  public String conformance() {
    return conformance;
  }

  public float pdfVersion() {
    return pdfVersion;
  }

  public boolean isArchival() {
    return this != DEFAULT;
  }

  /** PDF/A-1 allows neither transparency nor soft-masked images. */
  public boolean allowsTransparency() {
    return this != PDFA_1B;
  }

  /**
   * How the document is written. PDF 1.4 has no object or cross-reference streams, and
   * writing them would raise the file version to 1.6.
   */
  public CompressParameters compressParameters() {
    return this == PDFA_1B ? CompressParameters.NO_COMPRESSION : CompressParameters.DEFAULT_COMPRESSION;
  }

  /** Accepts the enum name or the short form, e.g. {@code "pdfa-2b"}. */
  public static PdfCompat parse(String value) {
    String normalized = value.trim().toUpperCase().replace('-', '_').replace("PDF/A", "PDFA");
    return PdfCompat.valueOf(normalized);
  }
}
