package ca.gc.cra.hostlink.infrastructure.net;

import ca.gc.cra.hostlink.logging.Logs;
import java.io.IOException;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An accepted socket together with its {@link ConnectionState}.
 * <p>Only the owning worker advances the state; {@link #close()} may be called from any thread (pool shutdown) and
 * wins over any in-flight transition.</p>
 *
 * @since 0.1.0
 */
public final class Connection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Connection.class);

  private final Socket socket;
  private final String peer;
  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);

  /**
   * Wraps an accepted socket.
   *
   * @param socket connected client socket
   */
  public Connection(Socket socket) {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.peer = Logs.peer(socket);
  }

  /**
   * Advances the state machine.
   *
   * @param next target state other than {@link ConnectionState#CLOSED}
   * @return {@code false} if the connection was closed concurrently; the caller should stop serving it
   * @throws IllegalStateException if the transition is not part of the state machine
   */
  public boolean transition(ConnectionState next) {
    Objects.requireNonNull(next, "next");
    if (next == ConnectionState.CLOSED) {
      throw new IllegalArgumentException("use close() to close a connection");
    }
    while (true) {
      ConnectionState current = state.get();
      if (current == ConnectionState.CLOSED) {
        return false;
      }
      if (!current.canTransitionTo(next)) {
        throw new IllegalStateException("Illegal connection transition " + current + " -> " + next);
      }
      if (state.compareAndSet(current, next)) {
        return true;
      }
    }
  }

  /**
   * Returns the current state.
   *
   * @return state snapshot
   */
  public ConnectionState state() {
    return state.get();
  }

  /**
   * Indicates whether {@link #close()} has run.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return state.get() == ConnectionState.CLOSED;
  }

  /**
   * Returns the printable remote address.
   *
   * @return {@code host:port}
   */
  public String peer() {
    return peer;
  }

  Socket socket() {
    return socket;
  }

  /**
   * Moves to {@link ConnectionState#CLOSED} and closes the socket, unblocking any pending read. Idempotent.
   */
  @Override
  public void close() {
    if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
      return;
    }
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing connection {}", peer, ex);
    }
  }
}
