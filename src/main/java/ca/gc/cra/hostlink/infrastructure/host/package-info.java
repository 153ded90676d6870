/**
 * Reference host scheduler: a tick-drained task queue and the standalone affinity thread that drains it.
 * <p>Embedding applications that own a run loop implement {@link ca.gc.cra.hostlink.application.port.HostTaskQueue}
 * themselves and skip this package.</p>
 */
package ca.gc.cra.hostlink.infrastructure.host;
