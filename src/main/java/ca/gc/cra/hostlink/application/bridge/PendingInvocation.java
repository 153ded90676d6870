package ca.gc.cra.hostlink.application.bridge;

import ca.gc.cra.hostlink.domain.command.Response;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One-shot rendezvous between a waiting worker and the affinity task that produces its {@link Response}.
 * <p>The slot moves from pending to either completed (the task delivered first) or abandoned (the waiter gave up
 * first). Exactly one of the two wins; a completion that loses is reported to the caller as late.</p>
 */
final class PendingInvocation {
  private static final int PENDING = 0;
  private static final int COMPLETED = 1;
  private static final int ABANDONED = 2;

  private final String label;
  private final long enqueuedNanos;
  private final CountDownLatch done = new CountDownLatch(1);
  private final AtomicInteger state = new AtomicInteger(PENDING);
  private volatile Response result;

  PendingInvocation(String label) {
    this.label = Objects.requireNonNull(label, "label");
    this.enqueuedNanos = System.nanoTime();
  }

  String label() {
    return label;
  }

  long enqueuedNanos() {
    return enqueuedNanos;
  }

  /**
   * Stores the result and releases the waiter.
   *
   * @param response outcome produced on the affinity thread
   * @return {@code false} when the waiter already abandoned the invocation or it was completed before
   */
  boolean complete(Response response) {
    Objects.requireNonNull(response, "response");
    if (state.get() != PENDING) {
      return false;
    }
    result = response;
    if (!state.compareAndSet(PENDING, COMPLETED)) {
      return false;
    }
    done.countDown();
    return true;
  }

  /**
   * Blocks until the result is available or the timeout elapses.
   *
   * @param timeout maximum wait
   * @return the delivered response, or empty when the invocation was abandoned on timeout
   * @throws InterruptedException if the waiting thread is interrupted; the invocation is abandoned first
   */
  Optional<Response> await(Duration timeout) throws InterruptedException {
    boolean signalled;
    try {
      signalled = done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      abandon();
      throw ex;
    }
    if (signalled || !abandon()) {
      return Optional.of(result);
    }
    return Optional.empty();
  }

  /**
   * Marks the invocation as abandoned unless it already completed.
   *
   * @return {@code true} if this call abandoned it
   */
  boolean abandon() {
    return state.compareAndSet(PENDING, ABANDONED);
  }
}
