package ca.gc.cra.hostlink.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named, non-daemon threads used by the HOSTLINK server.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the fixed-size pool that serves accepted connections.
   * <p>Connections beyond {@code size} wait in an unbounded FIFO queue until a worker frees up.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newConnectionWorkerPool(
      int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = namedFactory(prefix, "hostlink-worker", handler, true);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-threaded scheduler that plays the host's affinity thread in standalone runs.
   *
   * @param name thread name
   * @param handler uncaught exception handler installed on the thread
   * @return configured scheduler
   */
  public static ScheduledExecutorService newAffinityLoop(String name, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedFactory(name, "hostlink-affinity", handler, false);
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallback, UncaughtExceptionHandler handler, boolean indexed) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(indexed ? threadPrefix + "-" + index.getAndIncrement() : threadPrefix);
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
