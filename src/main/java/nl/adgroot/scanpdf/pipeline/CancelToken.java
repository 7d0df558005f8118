package nl.adgroot.scanpdf.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation signal shared by the caller and every pipeline stage.
 */
public final class CancelToken {

  private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

  public void cancel() {
    cancelled.complete(null);
  }

  public boolean isCancellationRequested() {
    return cancelled.isDone();
  }

  /** Completes when {@link #cancel()} is called. Never completes exceptionally. */
  public CompletableFuture<Void> whenCancelled() {
    return cancelled.copy();
  }
}
