package nl.adgroot.scanpdf.pdf;

import java.util.Calendar;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;

public record DocumentMetadata(String title, String author, String keywords, String subject, String creator) {

  public static final String DEFAULT_CREATOR = "Scan PDF Exporter";

  public static DocumentMetadata empty() {
    return new DocumentMetadata(null, null, null, null, null);
  }

  public static DocumentMetadata titled(String title) {
    return new DocumentMetadata(title, null, null, null, null);
  }

  public String effectiveCreator() {
    return creator == null || creator.isBlank() ? DEFAULT_CREATOR : creator;
  }

  /** Fills the document information dictionary. Blank fields are left out. */
  void applyTo(PDDocumentInformation info, Calendar now) {
    info.setCreator(effectiveCreator());
    info.setProducer(DEFAULT_CREATOR);
    if (isSet(title)) info.setTitle(title);
    if (isSet(author)) info.setAuthor(author);
    if (isSet(keywords)) info.setKeywords(keywords);
    if (isSet(subject)) info.setSubject(subject);
    info.setCreationDate(now);
    info.setModificationDate(now);
  }

  static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
