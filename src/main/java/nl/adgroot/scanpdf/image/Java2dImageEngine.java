package nl.adgroot.scanpdf.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import nl.adgroot.scanpdf.config.ExportConfig;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.w3c.dom.NodeList;

/**
 * Default {@link ImageEngine} backed by ImageIO for raster files and PDFBox for PDF pages.
 */
public class Java2dImageEngine implements ImageEngine {

  private final int pdfRenderDpi;
  private final float jpegQuality;
  private final int blackWhiteThreshold;

  public Java2dImageEngine(ExportConfig.RenderConfig cfg) {
    this(cfg.pdfRenderDpi, cfg.jpegQuality, cfg.blackWhiteThreshold);
  }

  public Java2dImageEngine(int pdfRenderDpi, float jpegQuality, int blackWhiteThreshold) {
    this.pdfRenderDpi = pdfRenderDpi;
    this.jpegQuality = jpegQuality;
    this.blackWhiteThreshold = blackWhiteThreshold;
  }

  @Override
  public MemoryImage render(PageImage page) throws IOException {
    PageSource source = page.source();

    if (source instanceof PageSource.Bitmap bitmap) {
      return new MemoryImage(bitmap.image(), bitmap.dpi(), bitmap.dpi(), bitmap.originalFormat());
    }
    if (source instanceof PageSource.ImageFile file) {
      return readImageFile(file.path());
    }
    if (source instanceof PageSource.PdfFile file) {
      try (PDDocument doc = Loader.loadPDF(file.path().toFile())) {
        return rasterizeFirstPage(doc);
      }
    }
    PageSource.PdfMemory memory = (PageSource.PdfMemory) source;
    try (PDDocument doc = Loader.loadPDF(memory.bytes())) {
      return rasterizeFirstPage(doc);
    }
  }

  private MemoryImage rasterizeFirstPage(PDDocument doc) throws IOException {
    if (doc.getNumberOfPages() == 0) {
      throw new IOException("PDF has no pages to render");
    }
    BufferedImage image = new PDFRenderer(doc).renderImageWithDPI(0, pdfRenderDpi, ImageType.RGB);
    return new MemoryImage(image, pdfRenderDpi, pdfRenderDpi, ImageFileFormat.UNSPECIFIED);
  }

  private static MemoryImage readImageFile(Path path) throws IOException {
    ImageFileFormat format = ImageFileFormat.fromFileName(path.getFileName().toString());

    try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
      if (in == null) {
        throw new IOException("Cannot open image: " + path);
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        throw new IOException("Unsupported image format: " + path);
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(in);
        BufferedImage image = reader.read(0);

        double hDpi;
        double vDpi;
        if (format == ImageFileFormat.JPEG) {
          JpegHeader header = JpegHeaderReader.read(path);
          hDpi = header == null ? 0 : header.horizontalDpi();
          vDpi = header == null ? 0 : header.verticalDpi();
        } else {
          IIOMetadata metadata = reader.getImageMetadata(0);
          hDpi = dpiFromStandardMetadata(metadata, "HorizontalPixelSize");
          vDpi = dpiFromStandardMetadata(metadata, "VerticalPixelSize");
        }
        return new MemoryImage(image, hDpi, vDpi, format);
      } finally {
        reader.dispose();
      }
    }
  }

  private static double dpiFromStandardMetadata(IIOMetadata metadata, String element) {
    if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
      return 0;
    }
    IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
    NodeList nodes = root.getElementsByTagName(element);
    if (nodes.getLength() == 0) {
      return 0;
    }
    String value = ((IIOMetadataNode) nodes.item(0)).getAttribute("value");
    try {
      double mmPerPixel = Double.parseDouble(value);
      return mmPerPixel > 0 ? 25.4 / mmPerPixel : 0;
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  @Override
  public MemoryImage blackWhite(MemoryImage source) {
    BufferedImage in = source.image();
    BufferedImage out = new BufferedImage(in.getWidth(), in.getHeight(), BufferedImage.TYPE_BYTE_BINARY);
    int threshold = blackWhiteThreshold;

    for (int y = 0; y < in.getHeight(); y++) {
      for (int x = 0; x < in.getWidth(); x++) {
        int rgb = in.getRGB(x, y);
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        int luma = (r * 299 + g * 587 + b * 114) / 1000;
        out.setRGB(x, y, luma >= threshold ? 0xFFFFFFFF : 0xFF000000);
      }
    }
    return source.withImage(out);
  }

  @Override
  public void encode(MemoryImage image, ImageFileFormat format, PixelFormat pixelFormatHint, OutputStream out)
      throws IOException {
    if (format == ImageFileFormat.PNG) {
      BufferedImage pixels = image.toPixelFormat(pixelFormatHint);
      if (!ImageIO.write(pixels, "png", out)) {
        throw new IOException("No PNG writer available");
      }
      return;
    }

    // JPEG has neither alpha nor 1-bit samples
    PixelFormat jpegFormat = switch (pixelFormatHint) {
      case BW1, GRAY8 -> PixelFormat.GRAY8;
      case RGB24, ARGB32 -> PixelFormat.RGB24;
    };
    BufferedImage pixels = image.toPixelFormat(jpegFormat);
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(ios);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(jpegQuality);
      writer.write(null, new IIOImage(pixels, null, null), param);
    } finally {
      writer.dispose();
    }
  }
}
