package ca.gc.cra.hostlink.domain.tool;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of tools the bridge can serve, keyed by their wire names.
 *
 * <p>Arbitrary code execution is deliberately absent: it is a separate, sandboxed capability and never
 * travels through the general dispatch path.</p>
 *
 * @since 0.1.0
 */
public enum Tool {
  GET_SCENE_INFO("get_scene_info"),
  GET_OBJECT_INFO("get_object_info"),
  GET_VIEWPORT_SCREENSHOT("get_viewport_screenshot"),
  GET_POLYHAVEN_CATEGORIES("get_polyhaven_categories"),
  SEARCH_POLYHAVEN_ASSETS("search_polyhaven_assets"),
  DOWNLOAD_POLYHAVEN_ASSET("download_polyhaven_asset"),
  SET_TEXTURE("set_texture"),
  GET_POLYHAVEN_STATUS("get_polyhaven_status"),
  GET_HYPER3D_STATUS("get_hyper3d_status"),
  GET_SKETCHFAB_STATUS("get_sketchfab_status");

  private static final Map<String, Tool> BY_WIRE_NAME =
      Stream.of(values()).collect(Collectors.toUnmodifiableMap(Tool::wireName, Function.identity()));

  private final String wireName;

  Tool(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name clients send in the {@code tool} field.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name to a tool. Matching is exact and case-sensitive.
   *
   * @param wireName name from a decoded command; {@code null} yields empty
   * @return matching tool, if any
   */
  public static Optional<Tool> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }
}
