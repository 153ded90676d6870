package ca.gc.cra.hostlink.application.port;

/**
 * Raised when an inbound message cannot be decoded into a command.
 * <p>The message text is sent back to the client verbatim, so it must not echo the full payload.</p>
 *
 * @since 0.1.0
 */
public final class ProtocolException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message client-facing description
   */
  public ProtocolException(String message) {
    super(message);
  }

  /**
   * Creates the exception with an underlying parser failure.
   *
   * @param message client-facing description
   * @param cause parser failure
   */
  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
