/**
 * Newline-delimited JSON command codec built on the Jackson streaming API.
 */
package ca.gc.cra.hostlink.infrastructure.codec;
