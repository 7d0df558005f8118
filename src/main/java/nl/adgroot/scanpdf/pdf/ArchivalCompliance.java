package nl.adgroot.scanpdf.pdf;

import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;
import javax.xml.transform.TransformerException;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.pdfbox.pdmodel.graphics.color.PDOutputIntent;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.PDFAIdentificationSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.XmpSerializer;

/**
 * Post-processing for archival (PDF/A) output: color profile, transparency and
 * the XMP metadata block mirroring the document information dictionary.
 */
final class ArchivalCompliance {

  static final String SRGB = "sRGB IEC61966-2.1";

  private ArchivalCompliance() {}

  static void apply(PDDocument doc, PdfCompat compat, DocumentMetadata metadata, Calendar now) throws IOException {
    if (!compat.isArchival()) {
      return;
    }
    if (compat == PdfCompat.PDFA_1B) {
      // PDF/A-1 has no transparency. The CIDSet of subset fonts is written by PDFBox when the font is embedded.
      for (PDPage page : doc.getPages()) {
        page.getCOSObject().removeItem(COSName.GROUP);
      }
    }
    doc.setVersion(compat.pdfVersion());
    addOutputIntent(doc);
    doc.getDocumentCatalog().setMetadata(xmpMetadata(doc, compat, metadata, now));
  }

  private static void addOutputIntent(PDDocument doc) throws IOException {
    if (!doc.getDocumentCatalog().getOutputIntents().isEmpty()) {
      return;
    }
    byte[] profile = ICC_Profile.getInstance(ColorSpace.CS_sRGB).getData();
    PDOutputIntent intent = new PDOutputIntent(doc, new ByteArrayInputStream(profile));
    intent.setInfo(SRGB);
    intent.setOutputCondition(SRGB);
    intent.setOutputConditionIdentifier(SRGB);
    intent.setRegistryName("http://www.color.org");
    doc.getDocumentCatalog().addOutputIntent(intent);
  }

  static PDMetadata xmpMetadata(PDDocument doc, PdfCompat compat, DocumentMetadata metadata, Calendar now)
      throws IOException {
    XMPMetadata xmp = XMPMetadata.createXMPMetadata();

    try {
      PDFAIdentificationSchema id = xmp.createAndAddPDFAIdentificationSchema();
      id.setPart(compat.part());
      id.setConformance(compat.conformance());
    } catch (BadFieldValueException e) {
      throw new IOException("Invalid PDF/A identification for " + compat, e);
    }

    DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
    if (DocumentMetadata.isSet(metadata.title())) dc.setTitle(metadata.title());
    if (DocumentMetadata.isSet(metadata.author())) dc.addCreator(metadata.author());
    if (DocumentMetadata.isSet(metadata.subject())) dc.setDescription(metadata.subject());

    AdobePDFSchema pdf = xmp.createAndAddAdobePDFSchema();
    pdf.setProducer(DocumentMetadata.DEFAULT_CREATOR);
    if (DocumentMetadata.isSet(metadata.keywords())) pdf.setKeywords(metadata.keywords());

    XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
    basic.setCreatorTool(metadata.effectiveCreator());
    basic.setCreateDate(now);
    basic.setModifyDate(now);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      new XmpSerializer().serialize(xmp, out, true);
    } catch (TransformerException e) {
      throw new IOException("Could not serialize XMP metadata", e);
    }

    PDMetadata pdMetadata = new PDMetadata(doc);
    pdMetadata.importXMPMetadata(out.toByteArray());
    return pdMetadata;
  }
}
