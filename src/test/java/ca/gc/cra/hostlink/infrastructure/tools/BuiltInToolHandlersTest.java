package ca.gc.cra.hostlink.infrastructure.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostlink.application.dispatch.ToolRegistry;
import ca.gc.cra.hostlink.domain.tool.Tool;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BuiltInToolHandlersTest {
  private final ToolRegistry registry =
      BuiltInToolHandlers.registerAll(ToolRegistry.builder(), AssetCatalog.builtIn(Path.of("dl"))).build();

  @Test
  void registersStatusAndAssetTools() {
    assertEquals(EnumSet.of(
        Tool.GET_POLYHAVEN_STATUS,
        Tool.GET_HYPER3D_STATUS,
        Tool.GET_SKETCHFAB_STATUS,
        Tool.GET_POLYHAVEN_CATEGORIES,
        Tool.SEARCH_POLYHAVEN_ASSETS,
        Tool.DOWNLOAD_POLYHAVEN_ASSET), registry.tools());
    assertTrue(registry.lookup(Tool.GET_SCENE_INFO).isEmpty());
  }

  @Test
  void statusToolsReportIntegrationState() throws Exception {
    assertEquals(Map.of("status", "PolyHaven integration is enabled"),
        registry.lookup(Tool.GET_POLYHAVEN_STATUS).orElseThrow().handle(Map.of()));
    assertEquals(Map.of("status", "Hyper3D integration is not configured"),
        registry.lookup(Tool.GET_HYPER3D_STATUS).orElseThrow().handle(Map.of()));
    assertEquals(Map.of("status", "Sketchfab integration is not configured"),
        registry.lookup(Tool.GET_SKETCHFAB_STATUS).orElseThrow().handle(Map.of()));
  }
}
