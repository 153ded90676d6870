/**
 * Logging utilities: root level control for the CLI and bounded excerpts of client-supplied text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.logging;
