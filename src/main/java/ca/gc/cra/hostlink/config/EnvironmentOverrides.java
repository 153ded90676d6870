package ca.gc.cra.hostlink.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps process environment variables onto configuration keys.
 * <p>{@code HOSTLINK_HOST} and {@code HOSTLINK_PORT} win over the legacy {@code BLENDER_MCP_HOST} and
 * {@code BLENDER_PORT} names.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentOverrides {
  private EnvironmentOverrides() {}

  /**
   * Extracts overrides from an environment map.
   *
   * @param env environment variables
   * @return configuration keys; empty when none of the variables are set
   */
  public static Map<String, String> fromEnvironment(Map<String, String> env) {
    Map<String, String> overrides = new LinkedHashMap<>();
    if (env == null) {
      return overrides;
    }
    putFirst(env, overrides, "host", "HOSTLINK_HOST", "BLENDER_MCP_HOST");
    putFirst(env, overrides, "port", "HOSTLINK_PORT", "BLENDER_PORT");
    putFirst(env, overrides, "workers", "HOSTLINK_WORKERS");
    putFirst(env, overrides, "commandTimeoutMs", "HOSTLINK_COMMAND_TIMEOUT_MS");
    return overrides;
  }

  private static void putFirst(
      Map<String, String> env, Map<String, String> target, String key, String... variables) {
    for (String variable : variables) {
      String value = env.get(variable);
      if (value != null && !value.isBlank()) {
        target.put(key, value.trim());
        return;
      }
    }
  }
}
