package ca.gc.cra.hostlink.api;

import ca.gc.cra.hostlink.config.ConfigMerger;
import ca.gc.cra.hostlink.config.DefaultsForMode;
import ca.gc.cra.hostlink.config.EnvironmentOverrides;
import ca.gc.cra.hostlink.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared configuration steps for the subcommands: locate the YAML file and merge all layers.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads and merges configuration for a mode.
   *
   * @param mode {@code serve} or {@code probe}
   * @param cliKv CLI pairs; {@code config} is consumed
   * @param environment environment variables
   * @param usage usage line printed on invalid input
   * @return effective flattened configuration
   * @throws CliAbort with the exit code to return when loading fails
   */
  static Map<String, String> effectiveConfig(
      String mode, Map<String, String> cliKv, Map<String, String> environment, String usage) throws CliAbort {
    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYaml(configPath, mode, usage);
    try {
      return ConfigMerger.buildEffectiveConfig(
          mode,
          yaml,
          cliKv,
          EnvironmentOverrides.fromEnvironment(environment),
          DefaultsForMode.asFlatMap(mode),
          log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /** Carries the exit code out of a failed configuration step. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
