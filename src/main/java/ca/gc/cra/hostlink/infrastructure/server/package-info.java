/**
 * <strong>Purpose:</strong> Server assembly and lifecycle: {@link ca.gc.cra.hostlink.infrastructure.server.BridgeServer}
 * builds instances, {@link ca.gc.cra.hostlink.infrastructure.server.ServerHandle} controls one, and
 * {@link ca.gc.cra.hostlink.infrastructure.server.ServerController} offers start-if-not-running and
 * stop-if-running.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.infrastructure.server;
