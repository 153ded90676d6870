package ca.gc.cra.hostlink.api;

import ca.gc.cra.hostlink.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry keys out of the effective configuration and into the {@code otel.*} system properties read
 * by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code args}.
   * Blank values leave the corresponding property untouched.
   *
   * @param args mutable configuration map
   * @return the exporter in effect ({@code otlp} or {@code none})
   * @throws IllegalArgumentException if a value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = normalize(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      System.setProperty(EXPORTER_PROPERTY, exporter);
    }

    String endpoint = normalize(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      requireHttpEndpoint(endpoint);
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
    }

    String attributes = normalize(args.remove("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty(RESOURCE_PROPERTY, attributes);
    }

    String effective = System.getProperty(EXPORTER_PROPERTY, "otlp");
    log.debug("Metrics exporter {} (endpoint {})", effective,
        endpoint.isEmpty() ? "default" : endpoint);
    return effective;
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim();
  }
}
