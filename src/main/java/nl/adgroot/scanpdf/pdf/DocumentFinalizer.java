package nl.adgroot.scanpdf.pdf;

import java.io.ByteArrayOutputStream;
import java.util.Calendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamps metadata, applies compliance and encryption, and serializes the generated
 * document to memory.
 */
public final class DocumentFinalizer {

  private static final Logger log = LoggerFactory.getLogger(DocumentFinalizer.class);

  private DocumentFinalizer() {}

  public static byte[] finish(GeneratedDocument document, ExportParams params) {
    return document.write(doc -> {
      Calendar now = Calendar.getInstance();
      params.metadata().applyTo(doc.getDocumentInformation(), now);
      ArchivalCompliance.apply(doc, params.compat(), params.metadata(), now);

      if (params.encryption().isEffective()) {
        doc.protect(params.encryption().toProtectionPolicy());
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      doc.save(out, params.compat().compressParameters());
      log.debug("Serialized {} page(s), {} bytes, compat={}", doc.getNumberOfPages(), out.size(), params.compat());
      return out.toByteArray();
    });
  }
}
