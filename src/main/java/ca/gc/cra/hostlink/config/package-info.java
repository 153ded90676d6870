/**
 * <strong>Purpose:</strong> Configuration records, loaders and the composition root.
 * <p><strong>Precedence:</strong> CLI {@code key=value} over YAML ({@code common} plus mode section) over
 * {@code HOSTLINK_*} environment variables over built-in defaults.</p>
 * <p><strong>Concurrency:</strong> Loaded once on the CLI thread; records are immutable afterwards.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostlink.config;
