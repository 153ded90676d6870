package ca.gc.cra.hostlink.infrastructure.host;

import ca.gc.cra.hostlink.application.port.HostTaskQueue;
import ca.gc.cra.hostlink.application.port.HostUnavailableException;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Multi-producer, single-consumer {@link HostTaskQueue} drained once per host tick.
 * <p><strong>Why:</strong> Reproduces the host's deferred-timer model: workers append closures at any time and the
 * host's run loop executes whatever was queued when its tick began.</p>
 * <p><strong>Thread-safety:</strong> {@link #enqueueOnce(Runnable)} accepts concurrent producers. The first thread
 * that calls {@link #drainTick()} becomes the only consumer; any other thread is rejected.</p>
 * <p><strong>Ordering:</strong> Tasks run FIFO, one at a time. Tasks enqueued while a tick is draining wait for the
 * next tick.</p>
 *
 * @since 0.1.0
 */
public final class TickDrivenTaskQueue implements HostTaskQueue {
  private static final Logger log = LoggerFactory.getLogger(TickDrivenTaskQueue.class);

  private final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
  private final AtomicInteger depth = new AtomicInteger();
  private final AtomicReference<Thread> consumer = new AtomicReference<>();
  // producers share the read side; close() takes the write side so no task slips in after close
  private final ReentrantReadWriteLock admission = new ReentrantReadWriteLock();
  private final MetricsPort metrics;
  private volatile boolean closed;

  /**
   * Creates an open queue.
   *
   * @param metrics metrics sink
   */
  public TickDrivenTaskQueue(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void enqueueOnce(Runnable task) throws HostUnavailableException {
    Objects.requireNonNull(task, "task");
    admission.readLock().lock();
    try {
      if (closed) {
        metrics.increment("host.queue.rejected");
        throw new HostUnavailableException("host is shutting down");
      }
      tasks.add(task);
      int queued = depth.incrementAndGet();
      metrics.increment("host.queue.enqueued");
      metrics.observe("host.queue.depth", queued);
    } finally {
      admission.readLock().unlock();
    }
  }

  /**
   * Runs the tasks that were queued when the call began, in enqueue order.
   * <p>A task that throws, including an {@link Error}, is logged and counted; the remaining tasks of the tick still
   * run.</p>
   *
   * @return number of tasks executed
   * @throws IllegalStateException if called from a thread other than the established consumer
   */
  public int drainTick() {
    claimConsumer();
    int budget = depth.get();
    int executed = 0;
    while (executed < budget) {
      Runnable task = tasks.poll();
      if (task == null) {
        break;
      }
      depth.decrementAndGet();
      executed++;
      try {
        task.run();
      } catch (RuntimeException ex) {
        metrics.increment("host.queue.taskFailed");
        log.error("Affinity task threw", ex);
      } catch (Error err) {
        // the bridge has already answered its waiter; later tasks must still run
        metrics.increment("host.queue.taskAborted");
        log.error("Affinity task aborted", err);
      }
    }
    return executed;
  }

  /**
   * Stops accepting new tasks. Tasks already queued remain and are run by subsequent {@link #drainTick()} calls.
   * Idempotent.
   */
  public void close() {
    admission.writeLock().lock();
    try {
      if (!closed) {
        closed = true;
        log.debug("Host task queue closed with {} pending task(s)", depth.get());
      }
    } finally {
      admission.writeLock().unlock();
    }
  }

  /**
   * Indicates whether the queue has been closed.
   *
   * @return {@code true} after {@link #close()}
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Returns the number of tasks waiting for a tick.
   *
   * @return current depth
   */
  public int pending() {
    return depth.get();
  }

  private void claimConsumer() {
    Thread current = Thread.currentThread();
    if (consumer.compareAndSet(null, current) || consumer.get() == current) {
      return;
    }
    throw new IllegalStateException(
        "Task queue is drained by " + consumer.get().getName() + ", not " + current.getName());
  }
}
