package ca.gc.cra.hostlink.domain.command;

import java.util.Locale;

/**
 * <strong>What:</strong> Classifies why a {@link Response} carries an error instead of a result.
 * <p><strong>Why:</strong> Lets logs and metrics distinguish a malformed message from a slow handler while the
 * wire format stays a plain {@code {"error": "..."}} object.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Message could not be decoded into a command. */
  PROTOCOL,
  /** Tool name is not served by the registry. */
  DISPATCH,
  /** Handler body failed on the affinity thread. */
  HANDLER,
  /** The affinity thread did not complete the command before the deadline. */
  TIMEOUT,
  /** The host refused the task because it is shutting down. */
  UNAVAILABLE;

  /**
   * Returns the lower-case label used as a metric suffix (e.g. {@code server.command.error.timeout}).
   *
   * @return metric-friendly label
   */
  public String metricLabel() {
    return name().toLowerCase(Locale.ROOT);
  }
}
