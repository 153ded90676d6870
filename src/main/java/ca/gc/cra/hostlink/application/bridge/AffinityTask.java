package ca.gc.cra.hostlink.application.bridge;

import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.application.port.ToolHandler;
import ca.gc.cra.hostlink.domain.command.ErrorKind;
import ca.gc.cra.hostlink.domain.command.Response;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Closure run by the host on its affinity thread for one {@link PendingInvocation}.
 * <p><strong>Why:</strong> Gives the host a plain {@link Runnable} while the bridge keeps control of result capture
 * and failure translation.</p>
 * <p><strong>Thread-safety:</strong> Runs at most once; a repeated {@link #run()} is ignored and counted.</p>
 */
final class AffinityTask implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(AffinityTask.class);

  private final ToolHandler handler;
  private final Map<String, Object> params;
  private final PendingInvocation pending;
  private final MetricsPort metrics;
  private final AtomicBoolean ran = new AtomicBoolean();

  AffinityTask(
      ToolHandler handler, Map<String, Object> params, PendingInvocation pending, MetricsPort metrics) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.params = Objects.requireNonNull(params, "params");
    this.pending = Objects.requireNonNull(pending, "pending");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    if (!ran.compareAndSet(false, true)) {
      metrics.increment("bridge.task.rerunIgnored");
      log.warn("Ignoring repeated execution of affinity task for {}", pending.label());
      return;
    }
    long start = System.nanoTime();
    metrics.observe("bridge.task.queueNanos", start - pending.enqueuedNanos());
    Response response = null;
    try {
      response = Response.ok(handler.handle(params));
      metrics.increment("bridge.task.succeeded");
    } catch (Exception ex) {
      metrics.increment("bridge.task.failed");
      log.debug("Tool {} failed on affinity thread", pending.label(), ex);
      response = Response.error(ErrorKind.HANDLER, describe(ex));
    } finally {
      if (response == null) {
        // an Error escaped the handler; release the waiter before it propagates
        response = Response.error(ErrorKind.HANDLER, "Command error: handler aborted");
      }
      metrics.observe("bridge.task.latencyNanos", System.nanoTime() - start);
      deliver(response);
    }
  }

  private void deliver(Response response) {
    if (pending.complete(response)) {
      return;
    }
    metrics.increment("bridge.task.lateCompletion");
    log.debug("Discarding late result for {}; waiter already timed out", pending.label());
  }

  static String describe(Exception ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return "Command error: " + ex.getClass().getSimpleName();
    }
    return message;
  }
}
