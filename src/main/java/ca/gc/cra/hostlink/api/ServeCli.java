package ca.gc.cra.hostlink.api;

import ca.gc.cra.hostlink.config.BridgeConfig;
import ca.gc.cra.hostlink.config.CompositionRoot;
import ca.gc.cra.hostlink.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.hostlink.infrastructure.net.ListenerBindException;
import ca.gc.cra.hostlink.infrastructure.server.ServerHandle;
import ca.gc.cra.hostlink.logging.LoggingConfigurator;
import ca.gc.cra.hostlink.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code hostlink serve}: runs the command server with a standalone affinity thread until the JVM is asked to
 * stop.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  static final String MODE = "serve";
  private static final Duration WAIT_SLICE = Duration.ofSeconds(5);
  private static final String SUMMARY_USAGE =
      "usage: serve [host=HOST] [port=0-65535 | listen=HOST:PORT] [workers=1-64] [commandTimeoutMs=N] "
          + "[tickIntervalMs=1-1000] [maxMessageBytes=N] [shutdownGraceMs=N] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      HOSTLINK command server

      Usage:
        serve [options]

      Options (validated):
        host=HOST                 Bind address (default localhost; env HOSTLINK_HOST)
        port=0-65535              TCP port, 0 for ephemeral (default 9876; env HOSTLINK_PORT)
        listen=HOST:PORT          Shorthand for host and port
        workers=1-64              Concurrent connections served (default 5)
        commandTimeoutMs=N        Wait for the affinity thread, 1-600000 ms (default 30000)
        tickIntervalMs=1-1000     Affinity tick interval (default 10)
        maxMessageBytes=N         Largest request line, 1024-67108864 (default 1048576)
        shutdownGraceMs=N         Time allowed for workers on stop (default 5000)
        downloadDir=PATH          Directory asset download paths resolve against (default java.io.tmpdir)
        logLevel=LEVEL            Root log level (TRACE, DEBUG, INFO, WARN, ERROR)
        config=PATH               YAML file with common/serve sections
        --dry-run                 Validate inputs and print the plan without binding
        metricsExporter=otlp|none Configure metrics exporter (default otlp)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging for troubleshooting
        --help                    Show this message
      """;

  private ServeCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.getenv());
  }

  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve CLI");
    }

    Map<String, String> cliKv;
    try {
      cliKv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, environment, SUMMARY_USAGE);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    BridgeConfig config;
    Path downloadDir;
    String exporter;
    try {
      exporter = TelemetryConfigurator.configureMetrics(configInputs);
      if (!input.verbose()) {
        LoggingConfigurator.applyLevel(configInputs.get("logLevel"));
      }
      config = BridgeConfig.fromMap(configInputs);
      downloadDir = Path.of(Strings.requireNonBlank("downloadDir", configInputs.get("downloadDir")));
    } catch (IllegalArgumentException | NullPointerException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config, downloadDir, exporter);
      return ExitCode.SUCCESS;
    }

    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    CompositionRoot root;
    try {
      root = new CompositionRoot(config, metrics, downloadDir);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Serve wiring configuration error: {}", ex.getMessage(), ex);
      metrics.close();
      return ExitCode.CONFIG_ERROR;
    }
    try {
      root.affinityHost().start();
      ServerHandle handle = root.controller().startIfNotRunning();
      Thread hook = new Thread(() -> shutdown(root, metrics), "hostlink-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      CliPrinter.println("HOSTLINK listening on " + handle.address().getHostString() + ":"
          + handle.address().getPort());
      while (!handle.awaitTermination(WAIT_SLICE)) {
        log.trace("Server on {} still running", handle.address());
      }
      return ExitCode.SUCCESS;
    } catch (ListenerBindException ex) {
      log.error("Cannot start server: {}", ex.getMessage());
      shutdown(root, metrics);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Serve interrupted; shutting down");
      shutdown(root, metrics);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in serve", ex);
      shutdown(root, metrics);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void shutdown(CompositionRoot root, OpenTelemetryMetricsAdapter metrics) {
    root.close();
    metrics.close();
  }

  private static void printDryRunPlan(BridgeConfig config, Path downloadDir, String exporter) {
    CliPrinter.printLines(
        "Serve dry-run: no socket will be bound.",
        " Listen           : " + config.host() + ":" + config.port(),
        " Workers          : " + config.workers(),
        " Command timeout  : " + config.commandTimeout().toMillis() + " ms",
        " Tick interval    : " + config.tickInterval().toMillis() + " ms",
        " Max message      : " + config.maxMessageBytes() + " bytes",
        " Shutdown grace   : " + config.shutdownGrace().toMillis() + " ms",
        " Download dir     : " + downloadDir,
        " Metrics exporter : " + exporter,
        " Re-run without --dry-run to start serving.");
  }
}
