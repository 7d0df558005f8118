package nl.adgroot.scanpdf.ocr;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import nl.adgroot.scanpdf.image.PageImage;
import nl.adgroot.scanpdf.pipeline.CancelToken;
import org.jetbrains.annotations.Nullable;

public interface OcrRequestQueue {

  /**
   * True when a result for this image is available (or already being computed),
   * so the caller does not need to persist the image again.
   */
  boolean hasCachedResult(OcrEngine engine, PageImage image, OcrParams params);

  /**
   * Queues recognition of {@code tempImageFile}. The queue takes ownership of the file and
   * deletes it once it is no longer needed, also when it was never read. The file may be
   * {@code null} when {@link #hasCachedResult} returned true.
   *
   * @return a future resolving to the result, or to {@code null} when OCR failed or was cancelled;
   *     it never completes exceptionally
   */
  CompletableFuture<OcrResult> enqueue(OcrEngine engine, PageImage image, @Nullable Path tempImageFile,
      OcrParams params, OcrPriority priority, CancelToken cancelToken);
}
