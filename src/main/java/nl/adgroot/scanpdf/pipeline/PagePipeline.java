package nl.adgroot.scanpdf.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Runs an ordered chain of stages over every item. Chains of different items interleave on
 * the executor; the collected results keep the input order.
 */
public final class PagePipeline<T> {

  private final List<T> items;
  private final List<Function<T, CompletableFuture<T>>> stages = new ArrayList<>();

  private PagePipeline(List<T> items) {
    this.items = List.copyOf(items);
  }

  public static <T> PagePipeline<T> forItems(List<T> items) {
    return new PagePipeline<>(items);
  }

  /** A stage that runs to completion on a worker thread. */
  public PagePipeline<T> step(UnaryOperator<T> fn) {
    stages.add(t -> CompletableFuture.completedFuture(fn.apply(t)));
    return this;
  }

  /** A stage that returns a future, e.g. waiting on OCR, without occupying a worker thread. */
  public PagePipeline<T> asyncStep(Function<T, CompletableFuture<T>> fn) {
    stages.add(fn);
    return this;
  }

  public CompletableFuture<List<T>> run(Executor executor) {
    List<CompletableFuture<T>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      CompletableFuture<T> chain = CompletableFuture.completedFuture(item);
      for (Function<T, CompletableFuture<T>> stage : stages) {
        chain = chain.thenComposeAsync(stage, executor);
      }
      futures.add(chain);
    }

    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
        .thenApply(v -> {
          List<T> results = new ArrayList<>(futures.size());
          for (CompletableFuture<T> f : futures) results.add(f.join());
          return results;
        });
  }
}
