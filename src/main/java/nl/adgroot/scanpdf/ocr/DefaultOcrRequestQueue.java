package nl.adgroot.scanpdf.ocr;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import nl.adgroot.scanpdf.image.PageImage;
import nl.adgroot.scanpdf.pipeline.CancelToken;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process OCR queue. Results are cached per (engine, image content, params);
 * a failed or cancelled request is evicted so a later export can retry it. Once the cache
 * holds {@code maxEntries} results, finished ones make room for new requests.
 */
public class DefaultOcrRequestQueue implements OcrRequestQueue {

  private static final Logger log = LoggerFactory.getLogger(DefaultOcrRequestQueue.class);

  private record CacheKey(String engineId, String imageKey, OcrParams params) {}

  private final Map<CacheKey, CompletableFuture<OcrResult>> cache = new ConcurrentHashMap<>();
  private final OcrPermitPool permits;
  private final Executor permitExecutor;
  private final int maxEntries;

  public DefaultOcrRequestQueue(OcrPermitPool permits, Executor permitExecutor, int maxEntries) {
    this.permits = permits;
    this.permitExecutor = permitExecutor;
    this.maxEntries = Math.max(1, maxEntries);
  }

  @Override
  public boolean hasCachedResult(OcrEngine engine, PageImage image, OcrParams params) {
    CompletableFuture<OcrResult> cached = cache.get(key(engine, image, params));
    return cached != null && (!cached.isDone() || cached.join() != null);
  }

  @Override
  public CompletableFuture<OcrResult> enqueue(OcrEngine engine, PageImage image, @Nullable Path tempImageFile,
      OcrParams params, OcrPriority priority, CancelToken cancelToken) {

    CacheKey key = key(engine, image, params);
    if (!cache.containsKey(key)) {
      evictFinished();
    }
    CompletableFuture<OcrResult> created = new CompletableFuture<>();
    CompletableFuture<OcrResult> existing = cache.putIfAbsent(key, created);
    if (existing != null) {
      deleteTempFile(tempImageFile);
      return existing;
    }

    permits.acquireAsync(priority, permitExecutor)
        .thenCompose(ignored -> runWithPermit(engine, tempImageFile, params, cancelToken))
        .whenComplete((result, ex) -> {
          deleteTempFile(tempImageFile);
          if (ex != null) {
            log.warn("OCR failed for {} with engine {}", image, engine.id(), ex);
            result = null;
          }
          if (result == null) {
            cache.remove(key, created);
          }
          created.complete(result);
        });

    return created;
  }

  private CompletableFuture<OcrResult> runWithPermit(OcrEngine engine, @Nullable Path file, OcrParams params,
      CancelToken cancelToken) {
    CompletableFuture<OcrResult> running;
    try {
      // no file: the cached result was evicted after the caller checked for it
      running = file == null || cancelToken.isCancellationRequested()
          ? CompletableFuture.completedFuture(null)
          : engine.process(file, params);
    } catch (RuntimeException e) {
      running = CompletableFuture.failedFuture(e);
    }
    // IMPORTANT: release the permit no matter what
    return running.whenComplete((r, ex) -> permits.release());
  }

  public int size() {
    return cache.size();
  }

  // in-flight requests are never evicted, so the cache can exceed maxEntries while they run
  private void evictFinished() {
    Iterator<CompletableFuture<OcrResult>> it = cache.values().iterator();
    while (cache.size() >= maxEntries && it.hasNext()) {
      if (it.next().isDone()) {
        it.remove();
      }
    }
  }

  private static CacheKey key(OcrEngine engine, PageImage image, OcrParams params) {
    return new CacheKey(engine.id(), image.contentKey(), params);
  }

  private static void deleteTempFile(@Nullable Path file) {
    if (file == null) return;
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete OCR temp file {}", file, e);
    }
  }
}
