/**
 * Thread and executor construction shared by the listener, worker pool and standalone host.
 */
package ca.gc.cra.hostlink.infrastructure.exec;
