package nl.adgroot.scanpdf.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.jetbrains.annotations.Nullable;

/**
 * Completed-page counter and cancellation signal shared between the caller and one export.
 */
public class ExportProgress {

  @FunctionalInterface
  public interface Listener {
    void onProgress(int done, int total);
  }

  private final CancelToken cancelToken;
  @Nullable
  private final Listener listener;
  private final AtomicInteger done = new AtomicInteger();
  private volatile int total;
  private volatile Instant started = Instant.now();

  public ExportProgress(CancelToken cancelToken, @Nullable Listener listener) {
    this.cancelToken = cancelToken;
    this.listener = listener;
  }

  public static ExportProgress none() {
    return new ExportProgress(new CancelToken(), null);
  }

  public static ExportProgress withListener(Listener listener) {
    return new ExportProgress(new CancelToken(), listener);
  }

  /** Called by the exporter once the page count is known. */
  public void start(int totalPages) {
    this.total = totalPages;
    this.done.set(0);
    this.started = Instant.now();
    notifyListener(0);
  }

  public void increment() {
    notifyListener(done.incrementAndGet());
  }

  public int done() {
    return done.get();
  }

  public int total() {
    return total;
  }

  public CancelToken cancelToken() {
    return cancelToken;
  }

  public boolean isCancellationRequested() {
    return cancelToken.isCancellationRequested();
  }

  public String formatStatus() {
    int d = done.get();
    int t = total;

    Duration elapsed = Duration.between(started, Instant.now());
    double elapsedSec = Math.max(0.001, elapsed.toMillis() / 1000.0);

    double throughput = d / elapsedSec; // pages/sec
    long etaSec = (throughput <= 0) ? 0 : (long) Math.ceil((t - d) / throughput);
    double pct = t == 0 ? 100.0 : (d * 100.0) / t;

    return String.format(
        "Page %d/%d (%.2f%%) | elapsed=%s | throughput=%.2f pages/s | ETA=%s",
        d, t, pct,
        fmtDuration(elapsed),
        throughput,
        fmtDuration(Duration.ofSeconds(etaSec))
    );
  }

  private void notifyListener(int value) {
    if (listener != null) {
      listener.onProgress(value, total);
    }
  }

  private static String fmtDuration(Duration d) {
    long s = d.getSeconds();
    long h = s / 3600;
    long m = (s % 3600) / 60;
    long sec = s % 60;
    if (h > 0) return String.format("%dh %02dm %02ds", h, m, sec);
    if (m > 0) return String.format("%dm %02ds", m, sec);
    return String.format("%ds", sec);
  }
}
