package ca.gc.cra.hostlink.application.port;

/**
 * Signals that the host scheduler refused a task because it is shutting down.
 *
 * @since 0.1.0
 */
public final class HostUnavailableException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the refusal
   */
  public HostUnavailableException(String message) {
    super(message);
  }
}
