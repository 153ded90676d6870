package ca.gc.cra.hostlink.config;

import ca.gc.cra.hostlink.application.dispatch.ToolRegistry;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.infrastructure.codec.NdjsonCommandCodec;
import ca.gc.cra.hostlink.infrastructure.host.AffinityThreadHost;
import ca.gc.cra.hostlink.infrastructure.server.BridgeServer;
import ca.gc.cra.hostlink.infrastructure.server.ServerController;
import ca.gc.cra.hostlink.infrastructure.tools.AssetCatalog;
import ca.gc.cra.hostlink.infrastructure.tools.BuiltInToolHandlers;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Wires the standalone HOSTLINK server: affinity host, tool registry, codec, server and
 * controller.
 * <p><strong>Why:</strong> Keeps the CLI free of construction details and gives tests one place to swap the
 * metrics adapter or add tools.</p>
 * <p><strong>Thread-safety:</strong> Construct on the startup thread; the built graph is then shared.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final AffinityThreadHost host;
  private final ToolRegistry registry;
  private final ServerController controller;

  /**
   * Builds the graph with the built-in tools only.
   *
   * @param config server configuration
   * @param metrics metrics adapter
   * @param downloadDirectory directory the asset catalogue resolves downloads against
   */
  public CompositionRoot(BridgeConfig config, MetricsPort metrics, Path downloadDirectory) {
    this(config, metrics, downloadDirectory, builder -> {});
  }

  /**
   * Builds the graph, letting the caller register extra tools (e.g. scene tools of an embedding host).
   *
   * @param config server configuration
   * @param metrics metrics adapter
   * @param downloadDirectory directory the asset catalogue resolves downloads against
   * @param extraTools registers additional handlers after the built-in ones
   */
  public CompositionRoot(
      BridgeConfig config,
      MetricsPort metrics,
      Path downloadDirectory,
      Consumer<ToolRegistry.Builder> extraTools) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(extraTools, "extraTools");
    ToolRegistry.Builder builder = BuiltInToolHandlers.registerAll(
        ToolRegistry.builder(), AssetCatalog.builtIn(Objects.requireNonNull(downloadDirectory, "downloadDirectory")));
    extraTools.accept(builder);
    this.registry = builder.build();
    this.host = new AffinityThreadHost(config.tickInterval(), config.shutdownGrace(), metrics);
    this.controller = new ServerController(
        new BridgeServer(config, registry, host.taskQueue(), new NdjsonCommandCodec(), metrics));
  }

  public AffinityThreadHost affinityHost() {
    return host;
  }

  public ToolRegistry registry() {
    return registry;
  }

  public ServerController controller() {
    return controller;
  }

  /**
   * Stops the server if running, then the affinity host.
   */
  @Override
  public void close() {
    controller.stopIfRunning();
    host.close();
  }
}
