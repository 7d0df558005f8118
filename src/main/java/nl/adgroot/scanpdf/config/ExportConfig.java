package nl.adgroot.scanpdf.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {

  public WorkerConfig workers = new WorkerConfig();
  public OcrConfig ocr = new OcrConfig();
  public RenderConfig render = new RenderConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class WorkerConfig {
    // 0 -> one thread per available processor
    public int threads = 0;

    // where page images are written before they are handed to OCR
    public String tempFolder = System.getProperty("java.io.tmpdir");

    public int resolvedThreads() {
      return threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OcrConfig {
    // false -> no OCR engine is available, OCR requests are skipped
    public boolean enabled = false;

    public String host = "127.0.0.1";
    public int port = 8884;
    public String path = "/ocr";
    public int timeoutSeconds = 120;

    // max OCR requests in flight at once
    public int concurrency = 2;

    // OCR results kept for reuse across exports
    public int cacheSize = 500;

    // TrueType font used for the invisible text layer; empty -> Standard 14 Times-Roman
    public String fontPath = "";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class RenderConfig {
    // resolution used to rasterize PDF pages that need OCR
    public int pdfRenderDpi = 300;
    public float jpegQuality = 0.75f;
    // luma at or above this value becomes white when reducing to black/white
    public int blackWhiteThreshold = 128;
  }
}
