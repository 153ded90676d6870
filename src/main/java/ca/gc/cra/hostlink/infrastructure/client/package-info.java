/**
 * Blocking command-protocol client used for connectivity probes.
 */
package ca.gc.cra.hostlink.infrastructure.client;
