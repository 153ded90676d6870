/**
 * <strong>Purpose:</strong> Tool dispatch: the immutable {@link ca.gc.cra.hostlink.application.dispatch.ToolRegistry}
 * and the {@link ca.gc.cra.hostlink.application.dispatch.CommandDispatcher} that routes decoded commands to the
 * affinity bridge.
 * <p><strong>Concurrency:</strong> Everything here is read-only after construction.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.application.dispatch;
