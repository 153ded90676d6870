package ca.gc.cra.hostlink.application.port;

/**
 * <strong>What:</strong> Port to the host scheduler that runs deferred work on the affinity thread.
 * <p><strong>Why:</strong> The host API may only be touched from one thread at specific points of its run loop; the
 * bridge hands work over through this port instead of calling the host directly.</p>
 * <p><strong>Role:</strong> Implemented by {@code TickDrivenTaskQueue} for standalone runs and by embedding hosts
 * that own their own loop.</p>
 * <p><strong>Thread-safety:</strong> {@link #enqueueOnce(Runnable)} must accept concurrent calls from many worker
 * threads. Tasks are consumed by a single thread in enqueue order.</p>
 *
 * @implNote Implementations must run every accepted task exactly once and must never re-queue it. There is no latency
 * bound beyond "before the host's next tick completes" while the host is alive.
 * @since 0.1.0
 */
public interface HostTaskQueue {
  /**
   * Schedules a task for a single execution on the affinity thread.
   *
   * @param task work to run; never {@code null}
   * @throws HostUnavailableException if the host is shutting down and no longer accepts work
   */
  void enqueueOnce(Runnable task) throws HostUnavailableException;
}
