package ca.gc.cra.hostlink.infrastructure.server;

import ca.gc.cra.hostlink.infrastructure.net.ListenerBindException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent start/stop operations for UI buttons and CLI commands, backed by an explicit {@link ServerHandle}.
 *
 * @since 0.1.0
 */
public final class ServerController {
  private static final Logger log = LoggerFactory.getLogger(ServerController.class);

  private final BridgeServer server;
  private ServerHandle current;

  /**
   * Creates a controller for a server blueprint.
   *
   * @param server server to start on demand
   */
  public ServerController(BridgeServer server) {
    this.server = Objects.requireNonNull(server, "server");
  }

  /**
   * Starts the server unless an instance is already running.
   *
   * @return the running instance's handle
   * @throws ListenerBindException if a new instance cannot bind its address
   */
  public synchronized ServerHandle startIfNotRunning() throws ListenerBindException {
    if (current != null && current.isRunning()) {
      log.info("HOSTLINK server already running on {}", current.address());
      return current;
    }
    current = server.start();
    return current;
  }

  /**
   * Stops the running instance, if any.
   *
   * @return {@code true} if an instance was running and has been stopped
   */
  public synchronized boolean stopIfRunning() {
    ServerHandle handle = current;
    current = null;
    if (handle == null || !handle.isRunning()) {
      log.debug("Stop requested but no HOSTLINK server is running");
      return false;
    }
    handle.stop();
    return true;
  }

  /**
   * Returns the handle of the running instance.
   *
   * @return handle, or empty when stopped
   */
  public synchronized Optional<ServerHandle> current() {
    return current != null && current.isRunning() ? Optional.of(current) : Optional.empty();
  }

  /**
   * Indicates whether an instance is running.
   *
   * @return {@code true} while an instance serves connections
   */
  public synchronized boolean isRunning() {
    return current != null && current.isRunning();
  }
}
