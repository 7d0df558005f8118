package nl.adgroot.scanpdf.embed;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import nl.adgroot.scanpdf.image.ImageEngine;
import nl.adgroot.scanpdf.image.JpegHeader;
import nl.adgroot.scanpdf.image.JpegHeaderReader;
import nl.adgroot.scanpdf.image.PageImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The one place that decides between copying a JPEG as-is and re-encoding pixels.
 */
public class EmbedderFactory {

  private static final Logger log = LoggerFactory.getLogger(EmbedderFactory.class);

  private final ImageEngine engine;
  private final float jpegQuality;

  public EmbedderFactory(ImageEngine engine, float jpegQuality) {
    this.engine = engine;
    this.jpegQuality = jpegQuality;
  }

  public Embedder create(PageImage page) throws IOException {
    Optional<Path> jpeg = page.untransformedJpegFile();
    if (jpeg.isPresent()) {
      JpegHeader header = JpegHeaderReader.read(jpeg.get());
      // grayscale JPEGs are known not to embed correctly
      if (header != null && header.numComponents() > 1) {
        return new DirectJpegEmbedder(header, jpeg.get());
      }
      log.debug("Re-encoding {} (header={})", jpeg.get(), header);
    }
    return new RenderedImageEmbedder(engine, engine.render(page), jpegQuality);
  }
}
