package ca.gc.cra.hostlink.infrastructure.server;

import ca.gc.cra.hostlink.application.bridge.AffinityBridge;
import ca.gc.cra.hostlink.application.dispatch.CommandDispatcher;
import ca.gc.cra.hostlink.application.dispatch.ToolRegistry;
import ca.gc.cra.hostlink.application.port.CommandCodec;
import ca.gc.cra.hostlink.application.port.HostTaskQueue;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.config.BridgeConfig;
import ca.gc.cra.hostlink.infrastructure.net.CommandListener;
import ca.gc.cra.hostlink.infrastructure.net.ConnectionWorkerPool;
import ca.gc.cra.hostlink.infrastructure.net.ListenerBindException;
import java.net.InetSocketAddress;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assembles listener, worker pool, dispatcher and affinity bridge into a running command
 * server.
 * <p><strong>Why:</strong> Each {@link #start()} builds a fresh listener and pool and returns a {@link ServerHandle};
 * there is no process-wide "running" flag to keep in sync.</p>
 * <p><strong>Thread-safety:</strong> {@code start()} may be called repeatedly; every call yields an independent
 * server instance sharing the registry, host queue and codec.</p>
 *
 * @since 0.1.0
 */
public final class BridgeServer {
  private static final Logger log = LoggerFactory.getLogger(BridgeServer.class);

  static final int LISTEN_BACKLOG = 50;

  private final BridgeConfig config;
  private final ToolRegistry registry;
  private final HostTaskQueue hostQueue;
  private final CommandCodec codec;
  private final MetricsPort metrics;

  /**
   * Creates a server blueprint.
   *
   * @param config validated server configuration
   * @param registry tool handlers
   * @param hostQueue host scheduler port
   * @param codec wire codec
   * @param metrics metrics sink
   */
  public BridgeServer(
      BridgeConfig config,
      ToolRegistry registry,
      HostTaskQueue hostQueue,
      CommandCodec codec,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.hostQueue = Objects.requireNonNull(hostQueue, "hostQueue");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Binds the configured address and starts serving.
   *
   * @return handle controlling the new server instance
   * @throws ListenerBindException if the address cannot be bound; nothing is left running
   */
  public ServerHandle start() throws ListenerBindException {
    AffinityBridge bridge = new AffinityBridge(hostQueue, config.commandTimeout(), metrics);
    CommandDispatcher dispatcher = new CommandDispatcher(registry, bridge, metrics);
    ConnectionWorkerPool pool =
        new ConnectionWorkerPool(config.workers(), codec, dispatcher, metrics, config.maxMessageBytes());
    CommandListener listener = new CommandListener(pool::submit, metrics);
    InetSocketAddress bound;
    try {
      bound = listener.start(new InetSocketAddress(config.host(), config.port()), LISTEN_BACKLOG);
    } catch (ListenerBindException ex) {
      pool.shutdown(config.shutdownGrace());
      throw ex;
    }
    log.info("HOSTLINK server started on {} with {} worker(s), {} tool(s), timeout {} ms",
        bound, config.workers(), registry.tools().size(), config.commandTimeout().toMillis());
    return new ServerHandle(listener, pool, bound, config.shutdownGrace());
  }
}
