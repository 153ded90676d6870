package ca.gc.cra.hostlink.application.dispatch;

import ca.gc.cra.hostlink.application.bridge.AffinityBridge;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.application.port.ToolHandler;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.command.ErrorKind;
import ca.gc.cra.hostlink.domain.command.Response;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a decoded {@link Command} to its handler and runs it through the
 * {@link AffinityBridge}.
 * <p><strong>Why:</strong> Unknown tools are answered on the worker thread without occupying a slot on the host's
 * affinity thread.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from shared immutable collaborators; safe for all workers.</p>
 *
 * @since 0.1.0
 */
public final class CommandDispatcher {
  private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

  private final ToolRegistry registry;
  private final AffinityBridge bridge;
  private final MetricsPort metrics;

  /**
   * Creates a dispatcher.
   *
   * @param registry handler table
   * @param bridge affinity bridge used for every known tool
   * @param metrics metrics sink
   */
  public CommandDispatcher(ToolRegistry registry, AffinityBridge bridge, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.bridge = Objects.requireNonNull(bridge, "bridge");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes one command.
   *
   * @param command decoded command
   * @return the tool's response or a classified error; never {@code null}
   */
  public Response dispatch(Command command) {
    Objects.requireNonNull(command, "command");
    metrics.increment("server.command.received");
    long start = System.nanoTime();

    Optional<ToolHandler> handler = registry.lookup(command.tool());
    if (handler.isEmpty()) {
      metrics.increment("server.command.error." + ErrorKind.DISPATCH.metricLabel());
      log.debug("Rejecting unknown tool {}", command.tool());
      return Response.error(ErrorKind.DISPATCH, "Unknown tool: " + command.tool());
    }

    log.debug("Dispatching {} with {} param(s)", command.tool(), command.params().size());
    Response response = bridge.submit(command.tool(), handler.get(), command.params());
    metrics.observe("server.command.latencyNanos", System.nanoTime() - start);
    if (response.isError()) {
      metrics.increment("server.command.error." + response.errorKind().metricLabel());
    } else {
      metrics.increment("server.command.succeeded");
    }
    return response;
  }
}
