package nl.adgroot.scanpdf.pdf;

import java.math.BigDecimal;
import java.math.RoundingMode;
import nl.adgroot.scanpdf.embed.Embedder;
import nl.adgroot.scanpdf.image.PageSize;
import org.jetbrains.annotations.Nullable;

/**
 * Page box size in points for an image of known pixel size and resolution.
 */
public final class PageGeometry {

  // 96 dpi, used when the resolution is unknown
  static final double FALLBACK_ADJUST = 0.75;

  // scanners and JPEG headers report whole-number dpi
  static final double DPI_TOLERANCE = 1.0;

  public record Size(double width, double height) {}

  private PageGeometry() {}

  public static Size realSize(Embedder embedder, @Nullable PageSize pageSize) {
    return realSize(embedder.width(), embedder.height(), embedder.horizontalDpi(), embedder.verticalDpi(), pageSize);
  }

  /**
   * Both values are rounded to 3 decimals; the page box and the image placement must use
   * exactly these numbers or viewers show a seam at the page edge.
   */
  public static Size realSize(int widthPx, int heightPx, double hDpi, double vDpi, @Nullable PageSize pageSize) {
    double hAdjust = 72 / hDpi;
    double vAdjust = 72 / vDpi;
    if (!Double.isFinite(hAdjust) || !Double.isFinite(vAdjust)) {
      hAdjust = vAdjust = FALLBACK_ADJUST;
    }
    double width = widthPx * hAdjust;
    double height = heightPx * vAdjust;

    if (pageSize != null) {
      double pageHDpi = widthPx / pageSize.widthInInches();
      double pageVDpi = heightPx / pageSize.heightInInches();
      if (Math.abs(hDpi - pageHDpi) <= DPI_TOLERANCE && Math.abs(vDpi - pageVDpi) <= DPI_TOLERANCE) {
        width = pageSize.widthInInches() * 72;
        height = pageSize.heightInInches() * 72;
      }
    }

    return new Size(round3(width), round3(height));
  }

  static double round3(double value) {
    return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
  }
}
