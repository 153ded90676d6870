package ca.gc.cra.hostlink.application.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostlink.application.port.HostTaskQueue;
import ca.gc.cra.hostlink.application.port.HostUnavailableException;
import ca.gc.cra.hostlink.domain.command.ErrorKind;
import ca.gc.cra.hostlink.domain.command.Response;
import ca.gc.cra.hostlink.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AffinityBridgeTest {
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
  }

  @Test
  void returnsHandlerResult() {
    AffinityBridge bridge = new AffinityBridge(new InlineQueue(), Duration.ofSeconds(1), metrics);

    Response response = bridge.submit("get_scene_info", params -> Map.of("name", "Scene"), Map.of());

    assertFalse(response.isError());
    assertEquals("Scene", response.payload().get("name"));
    assertEquals(1, metrics.count("bridge.submit.calls"));
    assertEquals(1, metrics.count("bridge.task.succeeded"));
    assertTrue(metrics.hasObservation("bridge.task.latencyNanos"));
  }

  @Test
  void nullHandlerResultBecomesEmptyPayload() {
    AffinityBridge bridge = new AffinityBridge(new InlineQueue(), Duration.ofSeconds(1), metrics);

    Response response = bridge.submit("noop", params -> null, null);

    assertFalse(response.isError());
    assertTrue(response.payload().isEmpty());
  }

  @Test
  void handlerExceptionMessageIsReturned() {
    AffinityBridge bridge = new AffinityBridge(new InlineQueue(), Duration.ofSeconds(1), metrics);

    Response response = bridge.submit("get_object_info", params -> {
      throw new IllegalArgumentException("Object not found: Ghost");
    }, Map.of("name", "Ghost"));

    assertEquals(ErrorKind.HANDLER, response.errorKind());
    assertEquals("Object not found: Ghost", response.error());
    assertEquals(1, metrics.count("bridge.task.failed"));
  }

  @Test
  void handlerExceptionWithoutMessageUsesTypeName() {
    AffinityBridge bridge = new AffinityBridge(new InlineQueue(), Duration.ofSeconds(1), metrics);

    Response response = bridge.submit("set_texture", params -> {
      throw new IllegalStateException();
    }, Map.of());

    assertEquals("Command error: IllegalStateException", response.error());
  }

  @Test
  void errorEscapingHandlerStillReleasesWaiter() {
    InlineQueue queue = new InlineQueue();
    AffinityBridge bridge = new AffinityBridge(queue, Duration.ofSeconds(1), metrics);

    Response response = bridge.submit("get_scene_info", params -> {
      throw new StackOverflowError();
    }, Map.of());

    assertEquals(ErrorKind.HANDLER, response.errorKind());
    assertEquals("Command error: handler aborted", response.error());
    assertInstanceOf(StackOverflowError.class, queue.escaped.get());
  }

  @Test
  void refusedEnqueueIsUnavailable() {
    HostTaskQueue closed = task -> {
      throw new HostUnavailableException("host is shutting down");
    };
    AffinityBridge bridge = new AffinityBridge(closed, Duration.ofSeconds(1), metrics);

    Response response = bridge.submit("get_scene_info", params -> Map.of(), Map.of());

    assertEquals(ErrorKind.UNAVAILABLE, response.errorKind());
    assertEquals(AffinityBridge.UNAVAILABLE_MESSAGE, response.error());
    assertEquals(1, metrics.count("bridge.submit.unavailable"));
  }

  @Test
  void timeoutLeavesTaskQueuedAndDropsLateResult() {
    ParkingQueue queue = new ParkingQueue();
    AffinityBridge bridge = new AffinityBridge(queue, Duration.ofSeconds(1), metrics);

    long start = System.nanoTime();
    Response response = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> bridge.submit(
        "get_viewport_screenshot", params -> Map.of("late", true), Map.of(), Duration.ofMillis(50)));
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMillis >= 50, "returned after " + elapsedMillis + " ms");
    assertEquals(ErrorKind.TIMEOUT, response.errorKind());
    assertEquals(AffinityBridge.TIMEOUT_MESSAGE, response.error());
    assertEquals(1, queue.parked.size());
    assertEquals(1, metrics.count("bridge.submit.timeout"));

    queue.parked.get(0).run();

    assertEquals(1, metrics.count("bridge.task.lateCompletion"));
  }

  @Test
  void taskRunsAtMostOnce() {
    ParkingQueue queue = new ParkingQueue();
    AffinityBridge bridge = new AffinityBridge(queue, Duration.ofSeconds(1), metrics);
    bridge.submit("get_scene_info", params -> Map.of(), Map.of(), Duration.ofMillis(1));

    Runnable task = queue.parked.get(0);
    task.run();
    task.run();

    assertEquals(1, metrics.count("bridge.task.succeeded"));
    assertEquals(1, metrics.count("bridge.task.rerunIgnored"));
  }

  @Test
  void interruptedWaiterGetsUnavailableAndKeepsInterruptFlag() {
    AffinityBridge bridge = new AffinityBridge(new ParkingQueue(), Duration.ofSeconds(5), metrics);

    Thread.currentThread().interrupt();
    Response response = bridge.submit("get_scene_info", params -> Map.of(), Map.of());
    boolean stillInterrupted = Thread.interrupted();

    assertEquals(ErrorKind.UNAVAILABLE, response.errorKind());
    assertTrue(response.error().startsWith("Server unavailable"));
    assertTrue(stillInterrupted);
    assertEquals(1, metrics.count("bridge.submit.interrupted"));
  }

  @Test
  void rejectsNonPositiveTimeouts() {
    assertThrows(IllegalArgumentException.class,
        () -> new AffinityBridge(new InlineQueue(), Duration.ZERO, metrics));
    AffinityBridge bridge = new AffinityBridge(new InlineQueue(), AffinityBridge.DEFAULT_TIMEOUT, metrics);
    assertThrows(IllegalArgumentException.class,
        () -> bridge.submit(params -> Map.of(), Map.of(), Duration.ofMillis(-1)));
    assertEquals(Duration.ofSeconds(30), bridge.defaultTimeout());
  }

  /** Runs each task on the submitting thread before the bridge starts waiting. */
  private static final class InlineQueue implements HostTaskQueue {
    final AtomicReference<Throwable> escaped = new AtomicReference<>();

    @Override
    public void enqueueOnce(Runnable task) {
      try {
        task.run();
      } catch (Error error) {
        escaped.set(error);
      }
    }
  }

  /** Accepts tasks without running them. */
  private static final class ParkingQueue implements HostTaskQueue {
    final List<Runnable> parked = new CopyOnWriteArrayList<>();

    @Override
    public void enqueueOnce(Runnable task) {
      parked.add(task);
    }
  }
}
