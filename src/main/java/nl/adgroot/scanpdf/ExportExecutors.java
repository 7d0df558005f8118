package nl.adgroot.scanpdf;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import nl.adgroot.scanpdf.config.ExportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pools shared by exports: a fixed pool running the stage functions and a cached
 * pool whose threads block waiting for OCR permits.
 */
public final class ExportExecutors implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ExportExecutors.class);

  private final ExecutorService workerPool;
  private final ExecutorService permitPoolExecutor;

  private ExportExecutors(ExecutorService workerPool, ExecutorService permitPoolExecutor) {
    this.workerPool = workerPool;
    this.permitPoolExecutor = permitPoolExecutor;
  }

  public static ExportExecutors create(ExportConfig cfg) {
    return create(cfg.workers.resolvedThreads());
  }

  public static ExportExecutors create(int workerThreads) {
    ThreadFactory workerTf = new ThreadFactory() {
      private final AtomicInteger n = new AtomicInteger(1);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, "export-worker-" + n.getAndIncrement());
        t.setDaemon(false);
        return t;
      }
    };

    ExecutorService workerPool = Executors.newFixedThreadPool(Math.max(1, workerThreads), workerTf);

    ExecutorService permitPoolExecutor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "ocr-permit");
      t.setDaemon(true);
      return t;
    });

    return new ExportExecutors(workerPool, permitPoolExecutor);
  }

  public ExecutorService workerPool() {
    return workerPool;
  }

  public ExecutorService permitPoolExecutor() {
    return permitPoolExecutor;
  }

  @Override
  public void close() throws InterruptedException {
    // stop accepting new tasks
    workerPool.shutdown();
    permitPoolExecutor.shutdown();

    // wait a bit for tasks to finish
    await(workerPool, "workerPool");
    await(permitPoolExecutor, "permitPoolExecutor");
  }

  private static void await(ExecutorService es, String name) throws InterruptedException {
    if (!es.awaitTermination(1, TimeUnit.MINUTES)) {
      es.shutdownNow();
      if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate: {}", name);
      }
    }
  }
}
