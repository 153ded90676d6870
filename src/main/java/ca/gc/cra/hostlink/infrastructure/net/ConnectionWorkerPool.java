package ca.gc.cra.hostlink.infrastructure.net;

import ca.gc.cra.hostlink.application.dispatch.CommandDispatcher;
import ca.gc.cra.hostlink.application.port.CommandCodec;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.infrastructure.exec.ExecutorFactories;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed set of {@link ConnectionWorker} threads; extra connections wait FIFO.
 * <p><strong>Why:</strong> Bounds thread usage while letting several clients hold long-lived sessions.</p>
 * <p><strong>Caution:</strong> The wait queue is unbounded. A flood of idle clients parks connections there
 * indefinitely, since a worker is held until its client disconnects.</p>
 * <p><strong>Thread-safety:</strong> {@link #submit(Socket)} is called by the acceptor thread;
 * {@link #shutdown(Duration)} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionWorkerPool {
  private static final Logger log = LoggerFactory.getLogger(ConnectionWorkerPool.class);

  private final ThreadPoolExecutor executor;
  private final Set<Connection> live = ConcurrentHashMap.newKeySet();
  private final CommandCodec codec;
  private final CommandDispatcher dispatcher;
  private final MetricsPort metrics;
  private final int maxMessageBytes;

  /**
   * Creates the pool and its threads' factory; threads start lazily.
   *
   * @param workers number of concurrent connections served
   * @param codec message codec
   * @param dispatcher command dispatcher
   * @param metrics metrics sink
   * @param maxMessageBytes per-message size limit
   */
  public ConnectionWorkerPool(
      int workers, CommandCodec codec, CommandDispatcher dispatcher, MetricsPort metrics, int maxMessageBytes) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.maxMessageBytes = maxMessageBytes;
    this.executor = ExecutorFactories.newConnectionWorkerPool(workers, "hostlink-worker", (thread, ex) -> {
      metrics.increment("server.worker.uncaught");
      log.error("Connection worker {} failed", thread.getName(), ex);
    });
  }

  /**
   * Hands an accepted socket to the next free worker, or queues it.
   *
   * @param socket accepted client socket
   */
  public void submit(Socket socket) {
    Connection connection = new Connection(socket);
    live.add(connection);
    try {
      executor.execute(new ConnectionWorker(connection, codec, dispatcher, metrics, maxMessageBytes, live::remove));
      metrics.observe("server.pool.waiting", executor.getQueue().size());
    } catch (RejectedExecutionException ex) {
      live.remove(connection);
      connection.close();
      metrics.increment("server.connection.rejected");
      log.warn("Rejected connection from {}: worker pool is shut down", connection.peer());
    }
  }

  /**
   * Returns the number of connections currently open, including queued ones.
   *
   * @return live connection count
   */
  public int liveConnections() {
    return live.size();
  }

  /**
   * Indicates whether {@link #shutdown(Duration)} has been called.
   *
   * @return {@code true} once shutting down
   */
  public boolean isShutdown() {
    return executor.isShutdown();
  }

  /**
   * Closes every live connection, stops accepting work and waits for workers to exit.
   * <p>Workers blocked in the bridge are interrupted once {@code grace} elapses.</p>
   *
   * @param grace time allowed for workers to finish
   * @return {@code true} if every worker exited
   */
  public boolean shutdown(Duration grace) {
    executor.shutdown();
    for (Connection connection : live) {
      connection.close();
    }
    try {
      if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Connection workers still busy after {} ms; interrupting", grace.toMillis());
      executor.shutdownNow();
      return executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
      return false;
    }
  }
}
