package ca.gc.cra.hostlink.infrastructure.tools;

import ca.gc.cra.hostlink.application.dispatch.ToolRegistry;
import ca.gc.cra.hostlink.application.port.ToolHandler;
import ca.gc.cra.hostlink.domain.tool.Tool;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registers the tools that need no host API: integration status reports and the asset catalogue.
 * <p>Scene, viewport and texture tools touch host state and are registered by the embedding host.</p>
 *
 * @since 0.1.0
 */
public final class BuiltInToolHandlers {
  private BuiltInToolHandlers() {}

  /**
   * Adds every built-in handler to the builder.
   *
   * @param builder registry under construction
   * @param catalog asset catalogue backing the PolyHaven tools
   * @return {@code builder}
   */
  public static ToolRegistry.Builder registerAll(ToolRegistry.Builder builder, AssetCatalog catalog) {
    return builder.registerAll(handlers(catalog));
  }

  /**
   * Returns the built-in handlers keyed by tool.
   *
   * @param catalog asset catalogue backing the PolyHaven tools
   * @return new mutable map
   */
  public static Map<Tool, ToolHandler> handlers(AssetCatalog catalog) {
    Map<Tool, ToolHandler> handlers = new EnumMap<>(Tool.class);
    handlers.put(Tool.GET_POLYHAVEN_STATUS, status("PolyHaven integration is enabled"));
    handlers.put(Tool.GET_HYPER3D_STATUS, status("Hyper3D integration is not configured"));
    handlers.put(Tool.GET_SKETCHFAB_STATUS, status("Sketchfab integration is not configured"));
    handlers.put(Tool.GET_POLYHAVEN_CATEGORIES, catalog::categories);
    handlers.put(Tool.SEARCH_POLYHAVEN_ASSETS, catalog::search);
    handlers.put(Tool.DOWNLOAD_POLYHAVEN_ASSET, catalog::download);
    return handlers;
  }

  private static ToolHandler status(String message) {
    return params -> Map.of("status", message);
  }
}
