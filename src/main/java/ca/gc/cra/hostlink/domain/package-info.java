/**
 * Core domain model for HOSTLINK command bridging.
 * <p><strong>Role:</strong> Commands, responses and the closed tool catalogue, free of socket or host dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to hand between worker and affinity threads.</p>
 * <p><strong>Security:</strong> Command parameters are caller supplied; handlers validate what they read.</p>
 */
package ca.gc.cra.hostlink.domain;
