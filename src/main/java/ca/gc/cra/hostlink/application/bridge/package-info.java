/**
 * Affinity execution bridge: one-shot pending invocations, the run-once task closure handed to the host, and the
 * blocking submit with timeout used by connection workers.
 */
package ca.gc.cra.hostlink.application.bridge;
