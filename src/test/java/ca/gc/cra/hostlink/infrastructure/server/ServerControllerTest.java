package ca.gc.cra.hostlink.infrastructure.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostlink.application.dispatch.ToolRegistry;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.config.BridgeConfig;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.tool.Tool;
import ca.gc.cra.hostlink.infrastructure.client.CommandClient;
import ca.gc.cra.hostlink.infrastructure.codec.NdjsonCommandCodec;
import ca.gc.cra.hostlink.infrastructure.host.AffinityThreadHost;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ServerControllerTest {
  private AffinityThreadHost host;
  private ServerController controller;

  @BeforeEach
  void setUp() {
    host = new AffinityThreadHost(Duration.ofMillis(2), Duration.ofMillis(500), MetricsPort.NO_OP);
    host.start();
    BridgeConfig config = new BridgeConfig("127.0.0.1", 0, 2, Duration.ofSeconds(5), Duration.ofMillis(2), 4096,
        Duration.ofMillis(200));
    ToolRegistry registry = ToolRegistry.builder()
        .register(Tool.GET_POLYHAVEN_STATUS, params -> Map.of("status", "ok"))
        .build();
    controller = new ServerController(
        new BridgeServer(config, registry, host.taskQueue(), new NdjsonCommandCodec(), MetricsPort.NO_OP));
  }

  @AfterEach
  void tearDown() {
    controller.stopIfRunning();
    host.close();
  }

  @Test
  void startIsIdempotentWhileRunning() throws Exception {
    ServerHandle first = controller.startIfNotRunning();
    ServerHandle second = controller.startIfNotRunning();

    assertSame(first, second);
    assertTrue(controller.isRunning());
    assertEquals(first, controller.current().orElseThrow());
  }

  @Test
  void stopThenStartAgainServes() throws Exception {
    ServerHandle first = controller.startIfNotRunning();
    assertTrue(controller.stopIfRunning());
    assertFalse(controller.isRunning());
    assertFalse(controller.stopIfRunning());
    assertTrue(controller.current().isEmpty());

    ServerHandle second = controller.startIfNotRunning();
    assertNotSame(first, second);
    try (CommandClient client = CommandClient.connect(second.address(), Duration.ofSeconds(5))) {
      assertEquals(Map.of("status", "ok"), client.send(Command.of("get_polyhaven_status")));
    }
  }
}
