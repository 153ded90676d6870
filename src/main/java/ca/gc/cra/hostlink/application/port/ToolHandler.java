package ca.gc.cra.hostlink.application.port;

import java.util.Map;

/**
 * <strong>What:</strong> Port for the body of one tool, executed on the host's affinity thread.
 * <p><strong>Why:</strong> Keeps host-specific operations (scene queries, rendering, asset handling) pluggable so
 * the bridge only deals with scheduling and results.</p>
 * <p><strong>Thread-safety:</strong> Implementations are invoked only from the affinity thread, one at a time, and
 * may therefore call single-threaded host APIs directly.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ToolHandler {
  /**
   * Executes the tool.
   *
   * @param params decoded command parameters; unmodifiable, never {@code null}
   * @return result fields written back to the caller; {@code null} is encoded as an empty object
   * @throws Exception when the tool fails; the message becomes the error response text
   */
  Map<String, Object> handle(Map<String, Object> params) throws Exception;
}
