package ca.gc.cra.hostlink.domain.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of exactly one {@link Command}: a result payload or an error message.
 * <p><strong>Why:</strong> Gives the codec a single shape to encode regardless of whether the command succeeded,
 * failed on the affinity thread, or never reached it.</p>
 * <p><strong>Role:</strong> Domain value object produced by the dispatcher/bridge and written by connection workers.</p>
 * <p><strong>Thread-safety:</strong> Immutable. Payload maps are copied; nested values are shared as supplied by
 * the handler, which must not mutate them after returning.</p>
 *
 * @param payload result fields for a successful command; empty for errors
 * @param error error message for a failed command; {@code null} on success
 * @param errorKind classification of the failure; {@code null} on success
 * @since 0.1.0
 */
public record Response(Map<String, Object> payload, String error, ErrorKind errorKind) {

  /**
   * Enforces that a response is either a success or a classified error.
   */
  public Response {
    if ((error == null) != (errorKind == null)) {
      throw new IllegalArgumentException("error and errorKind must both be present or both absent");
    }
    payload = payload == null || payload.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    if (error != null && !payload.isEmpty()) {
      throw new IllegalArgumentException("error responses must not carry a payload");
    }
  }

  /**
   * Creates a successful response.
   *
   * @param payload result fields; {@code null} is treated as an empty result
   * @return success response
   */
  public static Response ok(Map<String, Object> payload) {
    return new Response(payload, null, null);
  }

  /**
   * Creates an error response.
   *
   * @param kind failure classification
   * @param message human-readable message written to the {@code error} field
   * @return error response
   */
  public static Response error(ErrorKind kind, String message) {
    return new Response(Map.of(), Objects.requireNonNull(message, "message"),
        Objects.requireNonNull(kind, "kind"));
  }

  /**
   * Indicates whether this response reports a failure.
   *
   * @return {@code true} when {@link #error()} is set
   */
  public boolean isError() {
    return error != null;
  }
}
