package ca.gc.cra.hostlink.infrastructure.server;

import ca.gc.cra.hostlink.infrastructure.net.CommandListener;
import ca.gc.cra.hostlink.infrastructure.net.ConnectionWorkerPool;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Control surface of one running server instance returned by {@link BridgeServer#start()}.
 * <p>{@link #stop()} stops accepting, closes every live connection so blocked reads return, and waits for workers;
 * workers blocked in the bridge are released by their timeout or, after the grace period, by interruption.</p>
 *
 * @since 0.1.0
 */
public final class ServerHandle implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ServerHandle.class);

  private final CommandListener listener;
  private final ConnectionWorkerPool pool;
  private final InetSocketAddress address;
  private final Duration shutdownGrace;
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final CountDownLatch terminated = new CountDownLatch(1);

  ServerHandle(
      CommandListener listener, ConnectionWorkerPool pool, InetSocketAddress address, Duration shutdownGrace) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.address = Objects.requireNonNull(address, "address");
    this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
  }

  /**
   * Returns the bound address, including the actual port when an ephemeral one was requested.
   *
   * @return local address
   */
  public InetSocketAddress address() {
    return address;
  }

  /**
   * Indicates whether the instance is still serving.
   *
   * @return {@code false} once {@link #stop()} has been called
   */
  public boolean isRunning() {
    return !stopped.get();
  }

  /**
   * Returns the number of open client connections, including those waiting for a worker.
   *
   * @return live connection count
   */
  public int liveConnections() {
    return pool.liveConnections();
  }

  /**
   * Stops the instance. Idempotent; only the first call performs the shutdown.
   *
   * @return {@code true} if every worker exited within the grace period
   */
  public boolean stop() {
    if (!stopped.compareAndSet(false, true)) {
      return terminated.getCount() == 0;
    }
    log.info("Stopping HOSTLINK server on {}", address);
    listener.stop();
    boolean clean = pool.shutdown(shutdownGrace);
    try {
      if (!listener.awaitTermination(shutdownGrace)) {
        log.warn("Accept thread did not exit within {} ms", shutdownGrace.toMillis());
        clean = false;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      clean = false;
    }
    terminated.countDown();
    log.info("HOSTLINK server on {} stopped{}", address, clean ? "" : " (forced)");
    return clean;
  }

  /**
   * Blocks until {@link #stop()} has completed.
   *
   * @param timeout maximum wait
   * @return {@code true} if the server stopped within {@code timeout}
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void close() {
    stop();
  }
}
