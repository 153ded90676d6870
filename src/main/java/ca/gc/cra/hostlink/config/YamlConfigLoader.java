package ca.gc.cra.hostlink.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the HOSTLINK YAML file into the same flat {@code key=value} form the CLI accepts.
 * <p>The {@code common} section applies to every mode; the section named after the mode ({@code serve},
 * {@code probe}) is layered on top. Nested groups are joined in camelCase, so both forms below yield
 * {@code otelEndpoint}:</p>
 * <pre>
 * serve:
 *   otelEndpoint: http://collector:4317
 *   otel:
 *     endpoint: http://collector:4317
 * </pre>
 * <p>Supplying one key twice within a section, directly or through a group, is rejected.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Reads the settings that apply to a mode.
   *
   * @param path YAML file
   * @param mode CLI mode whose section applies on top of {@code common}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed, repeats a key or uses lists
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Map<?, ?> root;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      if (!(document instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException(path + ": top level must be a mapping of mode sections");
      }
      root = map;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }

    Map<String, String> settings = new LinkedHashMap<>(sectionSettings(root, COMMON_SECTION));
    settings.putAll(sectionSettings(root, section));
    return Optional.of(Map.copyOf(settings));
  }

  private static Yaml yaml() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    return new Yaml(new SafeConstructor(options));
  }

  private static Map<String, String> sectionSettings(Map<?, ?> root, String section) {
    Object node = root.get(section);
    if (node == null) {
      return Map.of();
    }
    if (!(node instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException("'" + section + "' must be a mapping");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    collect(section, entries, "", settings);
    return settings;
  }

  private static void collect(String section, Map<?, ?> entries, String group, Map<String, String> settings) {
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("'" + section + "' has a blank or non-text key");
      }
      String key = group.isEmpty() ? name.trim() : group + capitalize(name.trim());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(section, nested, key, settings);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("'" + section + "." + key + "': lists are not supported");
      } else if (settings.putIfAbsent(key, value == null ? "" : value.toString()) != null) {
        throw new IllegalArgumentException("'" + section + "." + key + "' is set more than once");
      }
    }
  }

  private static String capitalize(String name) {
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
