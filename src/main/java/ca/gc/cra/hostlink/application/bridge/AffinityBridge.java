package ca.gc.cra.hostlink.application.bridge;

import ca.gc.cra.hostlink.application.port.HostTaskQueue;
import ca.gc.cra.hostlink.application.port.HostUnavailableException;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.application.port.ToolHandler;
import ca.gc.cra.hostlink.domain.command.ErrorKind;
import ca.gc.cra.hostlink.domain.command.Response;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Hands tool invocations to the host's affinity thread and blocks the calling worker until
 * the result arrives or the deadline passes.
 * <p><strong>Why:</strong> Host APIs are single-threaded; connection workers must never call them directly, yet each
 * client expects a synchronous reply.</p>
 * <p><strong>Role:</strong> Application service between the dispatcher and the {@link HostTaskQueue} port.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@code submit} calls from every connection worker. Each call
 * owns a fresh {@link PendingInvocation}; nothing is shared between calls besides the queue.</p>
 * <p><strong>Failure semantics:</strong> Enqueue refusal yields an UNAVAILABLE error immediately. A missed deadline
 * yields a TIMEOUT error while the task stays queued and still runs; its result is then discarded.</p>
 *
 * @since 0.1.0
 */
public final class AffinityBridge {
  private static final Logger log = LoggerFactory.getLogger(AffinityBridge.class);

  /** Wait applied when no timeout is configured. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  /** Error text returned when the deadline passes before the host runs the task. */
  public static final String TIMEOUT_MESSAGE = "Command execution timeout";
  /** Error text returned when the host refuses new work. */
  public static final String UNAVAILABLE_MESSAGE = "Server unavailable: host is shutting down";

  private static final String ANONYMOUS = "anonymous";

  private final HostTaskQueue queue;
  private final Duration defaultTimeout;
  private final MetricsPort metrics;

  /**
   * Creates a bridge.
   *
   * @param queue host scheduler port
   * @param defaultTimeout wait applied by {@link #submit(String, ToolHandler, Map)}; must be positive
   * @param metrics metrics sink
   */
  public AffinityBridge(HostTaskQueue queue, Duration defaultTimeout, MetricsPort metrics) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.defaultTimeout = requirePositive(defaultTimeout);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs {@code handler} on the affinity thread using the configured default timeout.
   *
   * @param label tool name used in logs
   * @param handler tool body
   * @param params command parameters
   * @return handler result or a classified error
   */
  public Response submit(String label, ToolHandler handler, Map<String, Object> params) {
    return submit(label, handler, params, defaultTimeout);
  }

  /**
   * Runs {@code handler} on the affinity thread and waits at most {@code timeout}.
   *
   * @param handler tool body
   * @param params command parameters
   * @param timeout maximum wait; must be positive
   * @return handler result or a classified error
   */
  public Response submit(ToolHandler handler, Map<String, Object> params, Duration timeout) {
    return submit(ANONYMOUS, handler, params, timeout);
  }

  /**
   * Runs {@code handler} on the affinity thread and waits at most {@code timeout}.
   *
   * @param label tool name used in logs
   * @param handler tool body
   * @param params command parameters
   * @param timeout maximum wait; must be positive
   * @return handler result, the handler's failure message, or a TIMEOUT/UNAVAILABLE error
   */
  public Response submit(String label, ToolHandler handler, Map<String, Object> params, Duration timeout) {
    Objects.requireNonNull(handler, "handler");
    Duration wait = requirePositive(timeout);
    Map<String, Object> safeParams = params == null ? Map.of() : params;
    PendingInvocation pending = new PendingInvocation(label == null ? ANONYMOUS : label);
    AffinityTask task = new AffinityTask(handler, safeParams, pending, metrics);

    metrics.increment("bridge.submit.calls");
    try {
      queue.enqueueOnce(task);
    } catch (HostUnavailableException ex) {
      metrics.increment("bridge.submit.unavailable");
      log.debug("Host refused {}: {}", pending.label(), ex.getMessage());
      return Response.error(ErrorKind.UNAVAILABLE, UNAVAILABLE_MESSAGE);
    }

    long start = System.nanoTime();
    try {
      Optional<Response> result = pending.await(wait);
      metrics.observe("bridge.submit.waitNanos", System.nanoTime() - start);
      if (result.isPresent()) {
        return result.get();
      }
      metrics.increment("bridge.submit.timeout");
      log.warn("Tool {} did not complete within {} ms", pending.label(), wait.toMillis());
      return Response.error(ErrorKind.TIMEOUT, TIMEOUT_MESSAGE);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("bridge.submit.interrupted");
      log.debug("Interrupted while waiting for {}", pending.label());
      return Response.error(ErrorKind.UNAVAILABLE, "Server unavailable: interrupted while awaiting host");
    }
  }

  /**
   * Returns the timeout applied when callers do not pass one.
   *
   * @return default wait
   */
  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  private static Duration requirePositive(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    return timeout;
  }
}
