package ca.gc.cra.hostlink.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostlink.application.bridge.AffinityBridge;
import ca.gc.cra.hostlink.application.port.HostTaskQueue;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.command.ErrorKind;
import ca.gc.cra.hostlink.domain.command.Response;
import ca.gc.cra.hostlink.domain.tool.Tool;
import ca.gc.cra.hostlink.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CommandDispatcherTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final AtomicInteger enqueued = new AtomicInteger();
  private final HostTaskQueue inline = task -> {
    enqueued.incrementAndGet();
    task.run();
  };

  @Test
  void unknownToolNeverReachesTheHost() {
    CommandDispatcher dispatcher = dispatcher(ToolRegistry.builder().build());

    Response response = dispatcher.dispatch(Command.of("bogus_tool"));

    assertEquals(ErrorKind.DISPATCH, response.errorKind());
    assertEquals("Unknown tool: bogus_tool", response.error());
    assertEquals(0, enqueued.get());
    assertEquals(1, metrics.count("server.command.error.dispatch"));
  }

  @Test
  void knownButUnregisteredToolIsUnknown() {
    CommandDispatcher dispatcher = dispatcher(ToolRegistry.builder().build());

    Response response = dispatcher.dispatch(Command.of("get_scene_info"));

    assertEquals("Unknown tool: get_scene_info", response.error());
    assertEquals(0, enqueued.get());
  }

  @Test
  void registeredToolRunsWithParams() {
    ToolRegistry registry = ToolRegistry.builder()
        .register(Tool.GET_OBJECT_INFO, params -> Map.of("name", params.get("name")))
        .build();
    CommandDispatcher dispatcher = dispatcher(registry);

    Response response = dispatcher.dispatch(new Command("get_object_info", Map.of("name", "Cube")));

    assertFalse(response.isError());
    assertEquals("Cube", response.payload().get("name"));
    assertEquals(1, enqueued.get());
    assertEquals(1, metrics.count("server.command.received"));
    assertEquals(1, metrics.count("server.command.succeeded"));
    assertTrue(metrics.hasObservation("server.command.latencyNanos"));
  }

  @Test
  void handlerFailureIsCountedByKind() {
    ToolRegistry registry = ToolRegistry.builder()
        .register(Tool.SET_TEXTURE, params -> {
          throw new IllegalArgumentException("Texture not found");
        })
        .build();

    Response response = dispatcher(registry).dispatch(Command.of("set_texture"));

    assertEquals("Texture not found", response.error());
    assertEquals(1, metrics.count("server.command.error.handler"));
  }

  private CommandDispatcher dispatcher(ToolRegistry registry) {
    return new CommandDispatcher(registry, new AffinityBridge(inline, Duration.ofSeconds(1), metrics), metrics);
  }
}
