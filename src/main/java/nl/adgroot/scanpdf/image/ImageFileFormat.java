package nl.adgroot.scanpdf.image;

public enum ImageFileFormat {
  UNSPECIFIED,
  JPEG,
  PNG;

  public String extension() {
    return this == PNG ? ".png" : ".jpg";
  }

  public static ImageFileFormat fromFileName(String fileName) {
    String lower = fileName.toLowerCase();
    if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return JPEG;
    if (lower.endsWith(".png")) return PNG;
    return UNSPECIFIED;
  }
}
