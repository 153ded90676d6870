/**
 * <strong>Purpose:</strong> TCP transport: the listener, the fixed worker pool, per-connection workers, newline
 * framing and the connection state machine.
 * <p><strong>Concurrency:</strong> One acceptor thread, N worker threads; each connection is owned by exactly one
 * worker until it closes.</p>
 * <p><strong>Security:</strong> No authentication or encryption; bind to loopback unless the network is trusted.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.infrastructure.net;
