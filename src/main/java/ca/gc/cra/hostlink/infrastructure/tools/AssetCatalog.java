package ca.gc.cra.hostlink.infrastructure.tools;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static PolyHaven catalogue used when no online asset service is wired in.
 * <p>Categories are fixed per asset type; search filters a small built-in asset list; download resolves the local
 * path an asset would be stored under without fetching anything.</p>
 *
 * @since 0.1.0
 */
public final class AssetCatalog {
  static final String DEFAULT_CATEGORY_TYPE = "hdris";
  static final String ALL_TYPES = "all";

  private static final Map<String, List<String>> CATEGORIES = Map.of(
      "hdris", List.of("outdoor", "indoor", "studio", "nature"),
      "textures", List.of("fabric", "wood", "metal", "concrete", "plastic"),
      "models", List.of("furniture", "nature", "architecture", "props"));

  private final List<Asset> assets;
  private final Path downloadDirectory;

  /**
   * One catalogue entry.
   *
   * @param id asset identifier
   * @param name display name
   * @param type asset type ({@code hdris}, {@code textures} or {@code models})
   * @param category category within the type
   */
  public record Asset(String id, String name, String type, String category) {
    public Asset {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(category, "category");
    }

    Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", id);
      map.put("name", name);
      map.put("type", type);
      map.put("category", category);
      return map;
    }
  }

  /**
   * Creates a catalogue.
   *
   * @param assets searchable assets
   * @param downloadDirectory directory download paths are resolved against
   */
  public AssetCatalog(List<Asset> assets, Path downloadDirectory) {
    this.assets = List.copyOf(assets);
    this.downloadDirectory = Objects.requireNonNull(downloadDirectory, "downloadDirectory");
  }

  /**
   * Returns the built-in catalogue.
   *
   * @param downloadDirectory directory download paths are resolved against
   * @return catalogue with the default asset list
   */
  public static AssetCatalog builtIn(Path downloadDirectory) {
    return new AssetCatalog(List.of(
        new Asset("concrete_wall_01", "Concrete Wall 01", "textures", "concrete"),
        new Asset("wooden_floor_02", "Wooden Floor 02", "textures", "wood")), downloadDirectory);
  }

  Map<String, Object> categories(Map<String, Object> params) {
    String type = text(params, "asset_type", DEFAULT_CATEGORY_TYPE).toLowerCase(Locale.ROOT);
    return Map.of("categories", CATEGORIES.getOrDefault(type, List.of()));
  }

  Map<String, Object> search(Map<String, Object> params) {
    String type = text(params, "asset_type", ALL_TYPES).toLowerCase(Locale.ROOT);
    Set<String> wanted = Arrays.stream(text(params, "categories", "").split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(s -> s.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
    List<Map<String, Object>> matches = new ArrayList<>();
    for (Asset asset : assets) {
      boolean typeMatches = ALL_TYPES.equals(type) || asset.type().equals(type);
      boolean categoryMatches = wanted.isEmpty() || wanted.contains(asset.category());
      if (typeMatches && categoryMatches) {
        matches.add(asset.toMap());
      }
    }
    return Map.of("assets", matches);
  }

  Map<String, Object> download(Map<String, Object> params) {
    String id = text(params, "asset_id", "");
    if (id.isBlank()) {
      throw new IllegalArgumentException("asset_id is required");
    }
    if (!id.matches("[A-Za-z0-9._-]+") || id.startsWith(".")) {
      throw new IllegalArgumentException("asset_id contains unsupported characters: " + id);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("status", "Downloaded");
    result.put("asset_id", id);
    result.put("path", downloadDirectory.resolve(id + ".blend").toString());
    return result;
  }

  private static String text(Map<String, Object> params, String key, String fallback) {
    Object value = params.get(key);
    return value == null ? fallback : value.toString();
  }
}
