package ca.gc.cra.hostlink.infrastructure.host;

import ca.gc.cra.hostlink.application.port.HostTaskQueue;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Standalone host run loop: one named thread that drains a {@link TickDrivenTaskQueue} every
 * tick.
 * <p><strong>Why:</strong> Lets the bridge run outside an embedding application (CLI, tests) with the same
 * single-thread execution model a real host provides.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} once; {@link #close(Duration)} closes the queue, runs the tasks
 * still queued and stops the thread.</p>
 *
 * @since 0.1.0
 */
public final class AffinityThreadHost implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AffinityThreadHost.class);

  /** Name of the affinity thread. */
  public static final String THREAD_NAME = "hostlink-affinity";

  private final TickDrivenTaskQueue queue;
  private final Duration tickInterval;
  private final Duration shutdownGrace;
  private final MetricsPort metrics;
  private final ScheduledExecutorService loop;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a host that is not yet ticking.
   *
   * @param tickInterval delay between the end of one tick and the start of the next
   * @param shutdownGrace time allowed for queued tasks to finish on {@link #close()}
   * @param metrics metrics sink
   */
  public AffinityThreadHost(Duration tickInterval, Duration shutdownGrace, MetricsPort metrics) {
    this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
    this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.queue = new TickDrivenTaskQueue(metrics);
    this.loop = ExecutorFactories.newAffinityLoop(THREAD_NAME, (thread, ex) -> {
      metrics.increment("host.tick.uncaught");
      log.error("Uncaught failure on {}", thread.getName(), ex);
    });
  }

  /**
   * Returns the queue that producers should enqueue onto.
   *
   * @return host task queue port
   */
  public HostTaskQueue taskQueue() {
    return queue;
  }

  /**
   * Starts ticking.
   *
   * @throws IllegalStateException if already started or closed
   */
  public void start() {
    if (closed.get() || !started.compareAndSet(false, true)) {
      throw new IllegalStateException("Affinity host already started");
    }
    loop.scheduleWithFixedDelay(this::tick, 0L, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
    log.debug("Affinity host ticking every {} ms", tickInterval.toMillis());
  }

  private void tick() {
    try {
      int executed = queue.drainTick();
      if (executed > 0) {
        metrics.observe("host.tick.tasks", executed);
      }
    } catch (Throwable ex) {
      // a periodic task that throws is never rescheduled
      metrics.increment("host.tick.error");
      log.error("Affinity tick failed", ex);
    }
  }

  @Override
  public void close() {
    close(shutdownGrace);
  }

  /**
   * Closes the queue, runs remaining tasks and stops the thread. Idempotent.
   *
   * @param grace time allowed for queued tasks to finish before the thread is interrupted
   * @return {@code true} when the thread terminated within the grace period
   */
  public boolean close(Duration grace) {
    if (!closed.compareAndSet(false, true)) {
      return loop.isTerminated();
    }
    queue.close();
    if (started.get()) {
      loop.execute(this::tick);
    }
    loop.shutdown();
    try {
      if (loop.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Affinity thread did not stop within {} ms; interrupting", grace.toMillis());
      loop.shutdownNow();
      return loop.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      loop.shutdownNow();
      return false;
    }
  }
}
