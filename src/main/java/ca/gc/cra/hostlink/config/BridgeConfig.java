package ca.gc.cra.hostlink.config;

import ca.gc.cra.hostlink.validation.Net;
import ca.gc.cra.hostlink.validation.Numbers;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Validated settings for one command server.
 * <p><strong>Why:</strong> Every knob is range-checked once at startup so the listener, pool and bridge can trust
 * their inputs.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param host bind address; hostname or IP literal
 * @param port TCP port; {@code 0} selects an ephemeral port
 * @param workers number of connections served concurrently
 * @param commandTimeout how long a worker waits for the affinity thread
 * @param tickInterval delay between host ticks in standalone mode
 * @param maxMessageBytes largest accepted request line
 * @param shutdownGrace time allowed for workers and the host loop to finish on stop
 * @since 0.1.0
 */
public record BridgeConfig(
    String host,
    int port,
    int workers,
    Duration commandTimeout,
    Duration tickInterval,
    int maxMessageBytes,
    Duration shutdownGrace) {

  static final String DEFAULT_HOST = "localhost";
  static final int DEFAULT_PORT = 9876;
  static final int DEFAULT_WORKERS = 5;
  static final int MIN_WORKERS = 1;
  static final int MAX_WORKERS = 64;
  static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(30);
  static final Duration MIN_COMMAND_TIMEOUT = Duration.ofMillis(1);
  static final Duration MAX_COMMAND_TIMEOUT = Duration.ofMinutes(10);
  static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(10);
  static final Duration MIN_TICK_INTERVAL = Duration.ofMillis(1);
  static final Duration MAX_TICK_INTERVAL = Duration.ofMillis(1_000);
  static final int DEFAULT_MAX_MESSAGE_BYTES = 1024 * 1024;
  static final int MIN_MAX_MESSAGE_BYTES = 1024;
  static final int MAX_MAX_MESSAGE_BYTES = 64 * 1024 * 1024;
  static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(5);
  static final Duration MAX_SHUTDOWN_GRACE = Duration.ofMinutes(5);

  /**
   * Validates and normalizes all fields.
   */
  public BridgeConfig {
    host = Net.validateHost(host);
    Numbers.requireRange("port", port, 0, 65_535);
    Numbers.requireRange("workers", workers, MIN_WORKERS, MAX_WORKERS);
    Numbers.requireRange("commandTimeout", commandTimeout, MIN_COMMAND_TIMEOUT, MAX_COMMAND_TIMEOUT);
    Numbers.requireRange("tickInterval", tickInterval, MIN_TICK_INTERVAL, MAX_TICK_INTERVAL);
    Numbers.requireRange("maxMessageBytes", maxMessageBytes, MIN_MAX_MESSAGE_BYTES, MAX_MAX_MESSAGE_BYTES);
    Numbers.requireRange("shutdownGrace", shutdownGrace, Duration.ZERO, MAX_SHUTDOWN_GRACE);
  }

  /**
   * Returns the built-in defaults: {@code localhost:9876}, 5 workers, 30 s timeout, 10 ms ticks, 1 MiB messages.
   *
   * @return default configuration
   */
  public static BridgeConfig defaults() {
    return new BridgeConfig(
        DEFAULT_HOST,
        DEFAULT_PORT,
        DEFAULT_WORKERS,
        DEFAULT_COMMAND_TIMEOUT,
        DEFAULT_TICK_INTERVAL,
        DEFAULT_MAX_MESSAGE_BYTES,
        DEFAULT_SHUTDOWN_GRACE);
  }

  /**
   * Builds a configuration from flattened {@code key=value} pairs. Missing or blank keys keep their defaults;
   * a non-blank {@code listen=HOST:PORT} takes precedence over {@code host} and {@code port}.
   *
   * @param args configuration map; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static BridgeConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    BridgeConfig defaults = defaults();

    String host = nonBlankOr(kv.get("host"), defaults.host());
    int port = defaults.port();
    String portRaw = kv.get("port");
    if (portRaw != null && !portRaw.isBlank()) {
      port = Net.parsePort(portRaw, true);
    }
    String listen = kv.get("listen");
    if (listen != null && !listen.isBlank()) {
      Net.HostPort parsed = Net.parseHostPort(listen, true);
      host = parsed.host();
      port = parsed.port();
    }

    int workers = parseBoundedInt(kv, "workers", defaults.workers(), MIN_WORKERS, MAX_WORKERS);
    Duration timeout = parseMillis(kv, "commandTimeoutMs", defaults.commandTimeout());
    Duration tick = parseMillis(kv, "tickIntervalMs", defaults.tickInterval());
    int maxBytes = parseBoundedInt(
        kv, "maxMessageBytes", defaults.maxMessageBytes(), MIN_MAX_MESSAGE_BYTES, MAX_MAX_MESSAGE_BYTES);
    Duration grace = parseMillis(kv, "shutdownGraceMs", defaults.shutdownGrace());
    return new BridgeConfig(host, port, workers, timeout, tick, maxBytes, grace);
  }

  /**
   * Renders this configuration as flattened keys understood by {@link #fromMap(Map)}.
   *
   * @return ordered key/value map
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", host);
    map.put("port", Integer.toString(port));
    map.put("listen", "");
    map.put("workers", Integer.toString(workers));
    map.put("commandTimeoutMs", Long.toString(commandTimeout.toMillis()));
    map.put("tickIntervalMs", Long.toString(tickInterval.toMillis()));
    map.put("maxMessageBytes", Integer.toString(maxMessageBytes));
    map.put("shutdownGraceMs", Long.toString(shutdownGrace.toMillis()));
    return map;
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      return (int) Numbers.requireRange(key, parsed, min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw.trim() + ")", ex);
    }
  }

  private static Duration parseMillis(Map<String, String> kv, String key, Duration defaultValue) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Duration.ofMillis(Long.parseLong(raw.trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a whole number of milliseconds (was " + raw.trim() + ")",
          ex);
    }
  }

  private static String nonBlankOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
