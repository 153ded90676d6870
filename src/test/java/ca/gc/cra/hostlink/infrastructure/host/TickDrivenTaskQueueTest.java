package ca.gc.cra.hostlink.infrastructure.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostlink.application.port.HostUnavailableException;
import ca.gc.cra.hostlink.testutil.RecordingMetricsPort;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class TickDrivenTaskQueueTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final TickDrivenTaskQueue queue = new TickDrivenTaskQueue(metrics);

  @Test
  void drainsInSubmissionOrder() throws Exception {
    List<Integer> seen = new CopyOnWriteArrayList<>();
    for (int i = 0; i < 5; i++) {
      int value = i;
      queue.enqueueOnce(() -> seen.add(value));
    }

    assertEquals(5, queue.drainTick());
    assertEquals(List.of(0, 1, 2, 3, 4), seen);
    assertEquals(0, queue.pending());
    assertEquals(5, metrics.count("host.queue.enqueued"));
  }

  @Test
  void tasksQueuedDuringTickWaitForNextTick() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    queue.enqueueOnce(() -> {
      seen.add("first");
      try {
        queue.enqueueOnce(() -> seen.add("second"));
      } catch (HostUnavailableException ex) {
        throw new IllegalStateException(ex);
      }
    });

    assertEquals(1, queue.drainTick());
    assertEquals(List.of("first"), seen);
    assertEquals(1, queue.pending());

    assertEquals(1, queue.drainTick());
    assertEquals(List.of("first", "second"), seen);
  }

  @Test
  void failingTaskDoesNotStopTheTick() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    queue.enqueueOnce(() -> {
      throw new IllegalStateException("boom");
    });
    queue.enqueueOnce(() -> seen.add("after"));

    assertEquals(2, queue.drainTick());
    assertEquals(List.of("after"), seen);
    assertEquals(1, metrics.count("host.queue.taskFailed"));
  }

  @Test
  void taskThrowingErrorDoesNotStopTheTick() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    queue.enqueueOnce(() -> {
      throw new AssertionError("boom");
    });
    queue.enqueueOnce(() -> seen.add("after"));

    assertEquals(2, queue.drainTick());
    assertEquals(List.of("after"), seen);
    assertEquals(1, metrics.count("host.queue.taskAborted"));
  }

  @Test
  void closedQueueRefusesNewTasks() throws Exception {
    queue.enqueueOnce(() -> { });
    queue.close();
    queue.close();

    assertTrue(queue.isClosed());
    assertThrows(HostUnavailableException.class, () -> queue.enqueueOnce(() -> { }));
    assertEquals(1, metrics.count("host.queue.rejected"));
    assertEquals(1, queue.drainTick());
  }

  @Test
  void onlyOneThreadMayDrain() throws Exception {
    queue.drainTick();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread other = new Thread(() -> {
      try {
        queue.drainTick();
      } catch (Throwable ex) {
        failure.set(ex);
      }
    }, "intruder");
    other.start();
    other.join(5_000);

    assertTrue(failure.get() instanceof IllegalStateException);
  }
}
