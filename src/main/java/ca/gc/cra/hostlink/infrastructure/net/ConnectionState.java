package ca.gc.cra.hostlink.infrastructure.net;

/**
 * Lifecycle of one client connection.
 * <pre>
 * OPEN -&gt; AWAITING_MESSAGE -&gt; DISPATCHING -&gt; WRITING -&gt; AWAITING_MESSAGE ...
 * any state -&gt; CLOSED (terminal)
 * </pre>
 *
 * @since 0.1.0
 */
public enum ConnectionState {
  OPEN,
  AWAITING_MESSAGE,
  DISPATCHING,
  WRITING,
  CLOSED;

  /**
   * Reports whether moving from this state to {@code next} is allowed.
   *
   * @param next target state
   * @return {@code true} for a legal transition
   */
  public boolean canTransitionTo(ConnectionState next) {
    if (next == CLOSED) {
      return this != CLOSED;
    }
    return switch (this) {
      case OPEN, WRITING -> next == AWAITING_MESSAGE;
      case AWAITING_MESSAGE -> next == DISPATCHING;
      case DISPATCHING -> next == WRITING;
      case CLOSED -> false;
    };
  }
}
