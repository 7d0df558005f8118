package nl.adgroot.scanpdf.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.util.List;
import nl.adgroot.scanpdf.image.ImageMetadata;
import nl.adgroot.scanpdf.image.PageImage;
import org.junit.jupiter.api.Test;

class PageClassifierTest {

  @Test
  void classify_splitsByPdfSourceAndTransformFlag() {
    List<PageImage> pages = List.of(
        PageImage.ofFile(Path.of("scan.jpg"), ImageMetadata.defaults()),
        PageImage.ofFile(Path.of("imported.PDF"), ImageMetadata.defaults()),
        PageImage.ofPdfBytes(new byte[] {1, 2, 3}, ImageMetadata.defaults()),
        PageImage.ofFile(Path.of("rotated.pdf"), ImageMetadata.defaults()).asTransformed(),
        PageImage.ofFile(Path.of("scan.png"), ImageMetadata.defaults()));

    PageClassifier.Classification c = PageClassifier.classify(pages);

    assertEquals(List.of(0, 3, 4), c.toRender().stream().map(PageClassifier.ClassifiedPage::index).toList());
    assertEquals(List.of(1, 2), c.passthrough().stream().map(PageClassifier.ClassifiedPage::index).toList());
    assertEquals(5, c.total());
    c.toRender().forEach(p -> assertEquals(PageKind.TO_RENDER, p.kind()));
    c.passthrough().forEach(p -> assertEquals(PageKind.PASSTHROUGH, p.kind()));
  }

  @Test
  void classify_keepsTheSamePageImageInstances() {
    PageImage pdf = PageImage.ofFile(Path.of("a.pdf"), ImageMetadata.defaults());

    PageClassifier.Classification c = PageClassifier.classify(List.of(pdf));

    assertEquals(pdf, c.passthrough().get(0).image());
  }
}
