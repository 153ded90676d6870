package ca.gc.cra.hostlink.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Layers configuration sources: defaults, then environment, then YAML, then CLI.
 * <p>An explicit {@code host} or {@code port} from a higher layer clears a {@code listen} inherited from a lower
 * one so the more specific source wins.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Produces the effective flattened configuration.
   *
   * @param mode CLI mode, used in validation messages
   * @param yaml flattened YAML values, if a file was loaded
   * @param cli CLI {@code key=value} pairs
   * @param environment values derived from environment variables
   * @param defaults mode defaults
   * @param warn receives a message for each CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> environment,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    overlay(merged, environment == null ? Map.of() : environment);
    overlay(merged, yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
    }
    overlay(merged, cliCopy);

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void overlay(Map<String, String> merged, Map<String, String> layer) {
    if ((layer.containsKey("host") || layer.containsKey("port")) && !layer.containsKey("listen")) {
      merged.remove("listen");
    }
    for (Map.Entry<String, String> entry : layer.entrySet()) {
      if (entry.getKey() != null && entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
  }

  private static void validate(String mode, Map<String, String> effective) {
    String listen = effective.getOrDefault("listen", "").trim();
    if (!listen.isEmpty() && listen.indexOf(':') < 0) {
      throw new IllegalArgumentException("listen must use HOST:PORT format for " + mode);
    }
  }
}
