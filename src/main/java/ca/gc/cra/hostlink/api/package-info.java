/**
 * <strong>Purpose:</strong> Command-line entry points: {@code hostlink serve} and {@code hostlink probe}.
 * <p><strong>Conventions:</strong> Arguments are {@code key=value} pairs plus {@code --flags}; failures map to
 * {@link ca.gc.cra.hostlink.api.ExitCode} values instead of stack traces.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.api;
