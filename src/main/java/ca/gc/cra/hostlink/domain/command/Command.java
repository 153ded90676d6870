package ca.gc.cra.hostlink.domain.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One decoded request naming a tool and its parameters.
 * <p><strong>Why:</strong> Separates wire decoding from dispatch so the registry and bridge never see raw JSON.</p>
 * <p><strong>Role:</strong> Domain value object created by the codec and consumed once by the dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable; params are copied into an unmodifiable insertion-ordered map.</p>
 *
 * @param tool wire name of the requested tool; never {@code null}
 * @param params tool parameters in the order they appeared on the wire; {@code null} becomes empty
 * @since 0.1.0
 */
public record Command(String tool, Map<String, Object> params) {

  /**
   * Normalizes the tool name and freezes the parameter map.
   */
  public Command {
    tool = Objects.requireNonNull(tool, "tool");
    params = params == null || params.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  /**
   * Creates a command without parameters.
   *
   * @param tool wire name of the requested tool
   * @return command with an empty parameter map
   */
  public static Command of(String tool) {
    return new Command(tool, Map.of());
  }
}
