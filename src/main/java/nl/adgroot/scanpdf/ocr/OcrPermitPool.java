package nl.adgroot.scanpdf.ocr;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of OCR requests in flight. Background requests only take a permit
 * while no foreground request is waiting for one.
 */
public class OcrPermitPool {

  private final Semaphore permits;
  private final AtomicInteger foregroundWaiting = new AtomicInteger();

  /**
   * @param permits max concurrent OCR requests (>= 1)
   * @param fair whether waiting foreground requests are served FIFO
   */
  public OcrPermitPool(int permits, boolean fair) {
    this.permits = new Semaphore(Math.max(1, permits), fair);
  }

  /**
   * Blocks the calling thread until a permit is available.
   */
  public void acquire(OcrPriority priority) {
    try {
      if (priority == OcrPriority.FOREGROUND) {
        foregroundWaiting.incrementAndGet();
        try {
          permits.acquire();
        } finally {
          foregroundWaiting.decrementAndGet();
        }
        return;
      }

      for (;;) {
        if (foregroundWaiting.get() == 0 && permits.tryAcquire(20, TimeUnit.MILLISECONDS)) {
          return;
        }
        if (foregroundWaiting.get() > 0) {
          Thread.sleep(5); // yield to foreground work
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for an OCR permit", e);
    }
  }

  /**
   * Acquires a permit on {@code executor} so the caller's thread never blocks.
   */
  public CompletableFuture<Void> acquireAsync(OcrPriority priority, Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.runAsync(() -> acquire(priority), executor);
  }

  public void release() {
    permits.release();
  }
}
