/**
 * <strong>Purpose:</strong> Ports between the command bridge and everything it does not own: the host scheduler,
 * tool bodies, the wire codec and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise;
 * {@link ca.gc.cra.hostlink.application.port.ToolHandler} is the exception and runs only on the affinity thread.</p>
 * <p><strong>Security:</strong> Port boundaries assume validated configuration; command params are untrusted.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.application.port;
