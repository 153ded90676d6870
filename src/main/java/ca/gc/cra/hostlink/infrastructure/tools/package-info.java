/**
 * Built-in tool handlers that run without a host scene: integration status and the PolyHaven catalogue.
 */
package ca.gc.cra.hostlink.infrastructure.tools;
