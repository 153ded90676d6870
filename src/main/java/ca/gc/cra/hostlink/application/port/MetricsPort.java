package ca.gc.cra.hostlink.application.port;

/**
 * <strong>What:</strong> Port abstracting HOSTLINK metrics emission.
 * <p><strong>Why:</strong> Lets the bridge, workers and listener record counters and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from worker, acceptor and
 * affinity threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1); the affinity thread records
 * task latencies through this port.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g. {@code bridge.submit.timeout}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g. nanoseconds, queue depth)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; useful for tests and disabled exporters.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
