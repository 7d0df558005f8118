package nl.adgroot.scanpdf.pipeline;

import java.util.ArrayList;
import java.util.List;
import nl.adgroot.scanpdf.image.PageImage;

/**
 * Splits input pages into pages that must be rendered and PDF pages that can be imported
 * unchanged.
 */
public final class PageClassifier {

  public record ClassifiedPage(int index, PageImage image, PageKind kind) {}

  public record Classification(List<ClassifiedPage> toRender, List<ClassifiedPage> passthrough) {
    public int total() {
      return toRender.size() + passthrough.size();
    }
  }

  private PageClassifier() {}

  public static Classification classify(List<PageImage> images) {
    List<ClassifiedPage> toRender = new ArrayList<>();
    List<ClassifiedPage> passthrough = new ArrayList<>();
    for (int i = 0; i < images.size(); i++) {
      PageImage image = images.get(i);
      PageKind kind = kindOf(image);
      (kind == PageKind.PASSTHROUGH ? passthrough : toRender).add(new ClassifiedPage(i, image, kind));
    }
    return new Classification(List.copyOf(toRender), List.copyOf(passthrough));
  }

  public static PageKind kindOf(PageImage image) {
    return image.isPdf() && !image.isTransformed() ? PageKind.PASSTHROUGH : PageKind.TO_RENDER;
  }
}
