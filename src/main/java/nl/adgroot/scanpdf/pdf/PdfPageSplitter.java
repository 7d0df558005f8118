package nl.adgroot.scanpdf.pdf;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;

public class PdfPageSplitter {

  /**
   * Splits a PDF into one serialized single-page PDF per page, so each page can be
   * imported as its own input.
   */
  public List<byte[]> splitToPages(Path pdfPath) throws IOException {

    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {

      Splitter splitter = new Splitter();
      splitter.setSplitAtPage(1); // one page per document

      List<byte[]> pages = new ArrayList<>();
      for (PDDocument page : splitter.split(document)) {
        try (PDDocument p = page) {
          ByteArrayOutputStream out = new ByteArrayOutputStream();
          p.save(out);
          pages.add(out.toByteArray());
        }
      }
      return pages;
    }
  }

  public int pageCount(Path pdfPath) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
      return document.getNumberOfPages();
    }
  }
}
