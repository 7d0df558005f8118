package nl.adgroot.scanpdf.pdf;

import java.util.Objects;

/**
 * Settings for one export. Immutable.
 */
public record ExportParams(PdfCompat compat, EncryptionParams encryption, DocumentMetadata metadata) {

  public ExportParams {
    Objects.requireNonNull(compat, "compat");
    encryption = encryption == null ? EncryptionParams.none() : encryption;
    metadata = metadata == null ? DocumentMetadata.empty() : metadata;
  }

  public static ExportParams defaults() {
    return new ExportParams(PdfCompat.DEFAULT, EncryptionParams.none(), DocumentMetadata.empty());
  }

  public ExportParams withCompat(PdfCompat compat) {
    return new ExportParams(compat, encryption, metadata);
  }

  public ExportParams withEncryption(EncryptionParams encryption) {
    return new ExportParams(compat, encryption, metadata);
  }

  public ExportParams withMetadata(DocumentMetadata metadata) {
    return new ExportParams(compat, encryption, metadata);
  }
}
