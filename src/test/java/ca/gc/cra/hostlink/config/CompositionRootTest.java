package ca.gc.cra.hostlink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.tool.Tool;
import ca.gc.cra.hostlink.infrastructure.client.CommandClient;
import ca.gc.cra.hostlink.infrastructure.server.ServerHandle;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void wiresBuiltInToolsEndToEnd() throws Exception {
    BridgeConfig config = new BridgeConfig("127.0.0.1", 0, 2, Duration.ofSeconds(5), Duration.ofMillis(2), 4096,
        Duration.ofMillis(200));
    CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP, tempDir,
        builder -> builder.register(Tool.GET_SCENE_INFO, params -> Map.of("name", "Scene")));
    try {
      root.affinityHost().start();
      ServerHandle handle = root.controller().startIfNotRunning();

      try (CommandClient client = CommandClient.connect(handle.address(), Duration.ofSeconds(5))) {
        assertEquals(Map.of("status", "PolyHaven integration is enabled"),
            client.send(Command.of("get_polyhaven_status")));
        assertEquals(Map.of("name", "Scene"), client.send(Command.of("get_scene_info")));
        assertEquals("Unknown tool: get_object_info", client.send(Command.of("get_object_info")).get("error"));
      }
      assertTrue(root.registry().tools().contains(Tool.DOWNLOAD_POLYHAVEN_ASSET));
    } finally {
      root.close();
    }
    assertFalse(root.controller().isRunning());
  }
}
