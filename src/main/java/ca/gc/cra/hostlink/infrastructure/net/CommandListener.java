package ca.gc.cra.hostlink.infrastructure.net;

import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.logging.Logs;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Binds the command port and feeds accepted sockets to a consumer, normally the
 * {@link ConnectionWorkerPool}.
 * <p><strong>Lifecycle:</strong> One listening socket per instance; {@link #start(InetSocketAddress, int)} once,
 * {@link #stop()} any number of times.</p>
 * <p><strong>Thread-safety:</strong> Accepting runs on a dedicated thread; {@code stop()} may be called from any
 * thread and unblocks {@code accept()} by closing the socket.</p>
 *
 * @since 0.1.0
 */
public final class CommandListener {
  private static final Logger log = LoggerFactory.getLogger(CommandListener.class);

  static final String ACCEPTOR_THREAD = "hostlink-acceptor";
  private static final long ACCEPT_ERROR_BACKOFF_MILLIS = 50L;

  private final Consumer<Socket> connectionSink;
  private final MetricsPort metrics;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private volatile ServerSocket serverSocket;
  private volatile Thread acceptor;

  /**
   * Creates an unbound listener.
   *
   * @param connectionSink receives every accepted socket; must not block for long
   * @param metrics metrics sink
   */
  public CommandListener(Consumer<Socket> connectionSink, MetricsPort metrics) {
    this.connectionSink = Objects.requireNonNull(connectionSink, "connectionSink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Binds with {@code SO_REUSEADDR} and starts the accept loop.
   *
   * @param address address to bind; port {@code 0} selects an ephemeral port
   * @param backlog listen backlog
   * @return the bound local address
   * @throws ListenerBindException if the address cannot be bound
   * @throws IllegalStateException if already started
   */
  public InetSocketAddress start(InetSocketAddress address, int backlog) throws ListenerBindException {
    Objects.requireNonNull(address, "address");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Listener already started");
    }
    ServerSocket socket = null;
    try {
      socket = new ServerSocket();
      socket.setReuseAddress(true);
      socket.bind(address, backlog);
    } catch (IOException ex) {
      closeQuietly(socket);
      stopped.set(true);
      metrics.increment("server.listener.bindFailed");
      throw new ListenerBindException("Unable to bind " + Logs.peer(address) + ": " + ex.getMessage(), ex);
    }
    serverSocket = socket;
    InetSocketAddress bound = (InetSocketAddress) socket.getLocalSocketAddress();
    Thread thread = new Thread(this::acceptLoop, ACCEPTOR_THREAD);
    thread.setDaemon(false);
    acceptor = thread;
    thread.start();
    log.info("Listening for commands on {}", Logs.peer(bound));
    return bound;
  }

  private void acceptLoop() {
    ServerSocket socket = serverSocket;
    while (!stopped.get()) {
      Socket client;
      try {
        client = socket.accept();
      } catch (IOException ex) {
        if (stopped.get() || socket.isClosed()) {
          break;
        }
        metrics.increment("server.accept.error");
        log.warn("Accept failed: {}", ex.getMessage());
        if (!backoff()) {
          break;
        }
        continue;
      }
      metrics.increment("server.connection.accepted");
      try {
        connectionSink.accept(client);
      } catch (RuntimeException ex) {
        metrics.increment("server.connection.handoffFailed");
        log.error("Failed to hand off connection from {}", Logs.peer(client), ex);
        closeQuietly(client);
      }
    }
    log.debug("Accept loop exited");
  }

  private static boolean backoff() {
    try {
      TimeUnit.MILLISECONDS.sleep(ACCEPT_ERROR_BACKOFF_MILLIS);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Stops accepting and closes the listening socket. Established connections are left to their workers.
   * Idempotent.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    closeQuietly(serverSocket);
    log.info("Listener stopped");
  }

  /**
   * Waits for the accept thread to exit after {@link #stop()}.
   *
   * @param timeout maximum wait
   * @return {@code true} if the thread has exited or never started
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Thread thread = acceptor;
    if (thread == null) {
      return true;
    }
    thread.join(Math.max(1L, timeout.toMillis()));
    return !thread.isAlive();
  }

  private static void closeQuietly(AutoCloseable closeable) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception ex) {
      log.debug("Error closing {}", closeable, ex);
    }
  }
}
