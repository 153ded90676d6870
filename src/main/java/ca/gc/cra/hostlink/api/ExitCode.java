package ca.gc.cra.hostlink.api;

/**
 * Process exit codes returned by the HOSTLINK CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments or configuration values were rejected. */
  INVALID_ARGS(2),
  /** Network or file failure, including a port that cannot be bound. */
  IO_ERROR(3),
  /** Configuration was readable but inconsistent at runtime. */
  CONFIG_ERROR(4),
  /** Unexpected failure, or a probe answered with an error. */
  RUNTIME_FAILURE(5),
  /** Interrupted while running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
