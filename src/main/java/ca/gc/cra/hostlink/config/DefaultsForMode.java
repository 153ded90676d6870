package ca.gc.cra.hostlink.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened default settings per CLI mode; the lowest layer of {@link ConfigMerger}.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  /** Default wait for a probe response, in milliseconds. */
  public static final String PROBE_TIMEOUT_MS = "10000";
  /** Tool sent by a probe when none is given. */
  public static final String PROBE_TOOL = "get_polyhaven_status";

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a mode.
   *
   * @param mode {@code serve} or {@code probe}
   * @return immutable flattened defaults
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("metricsExporter", "otlp");
    defaults.put("otelEndpoint", "");
    defaults.put("otelResourceAttributes", "");
    defaults.put("logLevel", "");
    BridgeConfig bridge = BridgeConfig.defaults();
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "serve" -> {
        defaults.putAll(bridge.toFlatMap());
        defaults.put("downloadDir", System.getProperty("java.io.tmpdir"));
      }
      case "probe" -> {
        defaults.put("host", bridge.host());
        defaults.put("port", Integer.toString(bridge.port()));
        defaults.put("listen", "");
        defaults.put("tool", PROBE_TOOL);
        defaults.put("params", "{}");
        defaults.put("timeoutMs", PROBE_TIMEOUT_MS);
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }
}
