package nl.adgroot.scanpdf.image;

/**
 * Physical page size in inches, as requested from the scanner or chosen on import.
 */
public record PageSize(double widthInInches, double heightInInches) {

  public static final PageSize LETTER = new PageSize(8.5, 11);
  public static final PageSize LEGAL = new PageSize(8.5, 14);
  public static final PageSize A4 = fromMillimeters(210, 297);
  public static final PageSize A5 = fromMillimeters(148, 210);

  public PageSize {
    if (widthInInches <= 0 || heightInInches <= 0) {
      throw new IllegalArgumentException("Page size must be positive: " + widthInInches + "x" + heightInInches);
    }
  }

  public static PageSize fromMillimeters(double width, double height) {
    return new PageSize(width / 25.4, height / 25.4);
  }
}
