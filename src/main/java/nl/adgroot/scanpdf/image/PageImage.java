package nl.adgroot.scanpdf.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * One input page: its source plus export metadata. Immutable.
 */
public final class PageImage {

  private final PageSource source;
  private final ImageMetadata metadata;
  private final boolean transformed;

  private volatile String contentKey;

  public PageImage(PageSource source, ImageMetadata metadata, boolean transformed) {
    this.source = source;
    this.metadata = metadata == null ? ImageMetadata.defaults() : metadata;
    this.transformed = transformed;
  }

  public static PageImage ofFile(Path path, ImageMetadata metadata) {
    String name = path.getFileName().toString().toLowerCase();
    PageSource source = name.endsWith(".pdf") ? new PageSource.PdfFile(path) : new PageSource.ImageFile(path);
    return new PageImage(source, metadata, false);
  }

  public static PageImage ofPdfBytes(byte[] pdf, ImageMetadata metadata) {
    return new PageImage(new PageSource.PdfMemory(pdf), metadata, false);
  }

  public static PageImage ofImage(BufferedImage image, double dpi, ImageMetadata metadata) {
    return new PageImage(new PageSource.Bitmap(image, dpi, ImageFileFormat.UNSPECIFIED), metadata, false);
  }

  /** Returns a copy of this page marked as having had a pixel-level transform applied. */
  public PageImage asTransformed() {
    return new PageImage(source, metadata, true);
  }

  public PageSource source() {
    return source;
  }

  public ImageMetadata metadata() {
    return metadata;
  }

  public boolean isTransformed() {
    return transformed;
  }

  public boolean isPdf() {
    if (source instanceof PageSource.PdfFile file) {
      return file.path().getFileName().toString().toLowerCase().endsWith(".pdf");
    }
    return source instanceof PageSource.PdfMemory;
  }

  /**
   * Returns the JPEG file backing this page if it can be embedded without re-encoding,
   * i.e. the page is an untransformed JPEG file.
   */
  public Optional<Path> untransformedJpegFile() {
    if (!transformed
        && source instanceof PageSource.ImageFile file
        && ImageFileFormat.fromFileName(file.path().getFileName().toString()) == ImageFileFormat.JPEG) {
      return Optional.of(file.path());
    }
    return Optional.empty();
  }

  /**
   * Identity of the page content, used to key OCR results. Two pages with the same key
   * produce the same pixels.
   */
  @NotNull
  public String contentKey() {
    String key = contentKey;
    if (key == null) {
      key = computeContentKey() + (transformed ? "#t" : "");
      contentKey = key;
    }
    return key;
  }

  private String computeContentKey() {
    try {
      if (source instanceof PageSource.ImageFile file) {
        return fileKey(file.path());
      }
      if (source instanceof PageSource.PdfFile file) {
        return fileKey(file.path());
      }
      if (source instanceof PageSource.PdfMemory memory) {
        return "pdf:" + sha256(memory.bytes());
      }
      PageSource.Bitmap bitmap = (PageSource.Bitmap) source;
      return "mem:" + rasterDigest(bitmap.image());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static String fileKey(Path path) throws IOException {
    Path abs = path.toAbsolutePath().normalize();
    return "file:" + abs + ":" + Files.size(abs) + ":" + Files.getLastModifiedTime(abs).toMillis();
  }

  private static String sha256(byte[] bytes) {
    return HexFormat.of().formatHex(sha256().digest(bytes));
  }

  /** SHA-256 over the size and the ARGB value of every pixel, row by row. */
  static String rasterDigest(BufferedImage image) {
    MessageDigest digest = sha256();
    int width = image.getWidth();
    int height = image.getHeight();
    digest.update(ByteBuffer.allocate(8).putInt(width).putInt(height).array());

    int[] pixels = new int[width];
    ByteBuffer row = ByteBuffer.allocate(width * 4);
    for (int y = 0; y < height; y++) {
      image.getRGB(0, y, width, 1, pixels, 0, width);
      row.clear();
      row.asIntBuffer().put(pixels);
      digest.update(row.array());
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public String toString() {
    return "PageImage[" + source.getClass().getSimpleName() + (transformed ? ", transformed" : "") + "]";
  }
}
