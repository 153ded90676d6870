package ca.gc.cra.hostlink.api;

import ca.gc.cra.hostlink.application.port.ProtocolException;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.command.Response;
import ca.gc.cra.hostlink.infrastructure.client.CommandClient;
import ca.gc.cra.hostlink.infrastructure.codec.NdjsonCommandCodec;
import ca.gc.cra.hostlink.validation.Net;
import ca.gc.cra.hostlink.validation.Numbers;
import ca.gc.cra.hostlink.validation.Strings;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code hostlink probe}: connectivity check that sends one command and prints the JSON reply.
 * <p>Exit status is {@code SUCCESS} for a result, {@code RUNTIME_FAILURE} when the server answered with an error
 * and {@code IO_ERROR} when it could not be reached.</p>
 *
 * @since 0.1.0
 */
public final class ProbeCli {
  private static final Logger log = LoggerFactory.getLogger(ProbeCli.class);
  static final String MODE = "probe";
  private static final long MAX_TIMEOUT_MILLIS = 600_000L;
  private static final String SUMMARY_USAGE =
      "usage: probe [host=HOST] [port=1-65535 | listen=HOST:PORT] [tool=NAME] [params=JSON] [timeoutMs=N] "
          + "[config=PATH]";
  private static final String HELP_TEXT = """
      HOSTLINK connectivity probe

      Usage:
        probe [options]

      Options:
        host=HOST          Server host (default localhost; env HOSTLINK_HOST)
        port=1-65535       Server port (default 9876; env HOSTLINK_PORT)
        listen=HOST:PORT   Shorthand for host and port
        tool=NAME          Tool to invoke (default get_polyhaven_status)
        params=JSON        JSON object passed as params (default {})
        timeoutMs=N        Connect and read timeout, 1-600000 ms (default 10000)
        config=PATH        YAML file with common/probe sections
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private ProbeCli() {}

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

    Map<String, String> effective;
    try {
      Map<String, String> cliKv = CliArgsParser.toMap(input.keyValueArgs());
      effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, environment, SUMMARY_USAGE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    }

    NdjsonCommandCodec codec = new NdjsonCommandCodec();
    InetSocketAddress target;
    Command command;
    Duration timeout;
    try {
      target = resolveTarget(effective);
      String tool = Strings.requireNonBlank("tool", effective.get("tool"));
      command = new Command(tool, codec.decodeObject(effective.getOrDefault("params", "{}")));
      long millis = Long.parseLong(Strings.requireNonBlank("timeoutMs", effective.get("timeoutMs")));
      timeout = Duration.ofMillis(Numbers.requireRange("timeoutMs", millis, 1L, MAX_TIMEOUT_MILLIS));
    } catch (ProtocolException ex) {
      log.error("params must be a JSON object: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException | NullPointerException ex) {
      log.error("Invalid probe configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.debug("Probing {} with tool {}", target, command.tool());
    try (CommandClient client = CommandClient.connect(target, timeout)) {
      Map<String, Object> reply = client.send(command);
      CliPrinter.println(codec.encode(Response.ok(reply)));
      if (reply.containsKey("error")) {
        log.warn("Server answered {} with an error", command.tool());
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (ProtocolException ex) {
      log.error("Malformed reply from {}: {}", target, ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Cannot reach HOSTLINK server at {}: {}", target, ex.getMessage());
      return ExitCode.IO_ERROR;
    }
  }

  private static InetSocketAddress resolveTarget(Map<String, String> effective) {
    String listen = effective.getOrDefault("listen", "");
    if (!listen.isBlank()) {
      Net.HostPort hostPort = Net.parseHostPort(listen, false);
      return new InetSocketAddress(hostPort.host(), hostPort.port());
    }
    String host = Net.validateHost(effective.get("host"));
    int port = Net.parsePort(effective.get("port"), false);
    return new InetSocketAddress(host, port);
  }
}
