package ca.gc.cra.hostlink.infrastructure.net;

import java.io.IOException;

/**
 * Raised when the command listener cannot bind its address, typically because the port is already in use.
 *
 * @since 0.1.0
 */
public final class ListenerBindException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message operator-facing description including the address
   * @param cause underlying socket failure
   */
  public ListenerBindException(String message, Throwable cause) {
    super(message, cause);
  }
}
