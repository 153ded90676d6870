package ca.gc.cra.hostlink.infrastructure.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssetCatalogTest {
  private final Path downloads = Path.of("downloads");
  private final AssetCatalog catalog = AssetCatalog.builtIn(downloads);

  @Test
  void categoriesDefaultToHdris() {
    assertEquals(List.of("outdoor", "indoor", "studio", "nature"), catalog.categories(Map.of()).get("categories"));
    assertEquals(List.of(), catalog.categories(Map.of("asset_type", "sounds")).get("categories"));
  }

  @Test
  void searchFiltersByTypeAndCategory() {
    List<?> all = (List<?>) catalog.search(Map.of()).get("assets");
    List<?> wood = (List<?>) catalog.search(Map.of("asset_type", "textures", "categories", "Wood")).get("assets");
    List<?> models = (List<?>) catalog.search(Map.of("asset_type", "models")).get("assets");

    assertEquals(2, all.size());
    assertEquals(1, wood.size());
    assertEquals("wooden_floor_02", ((Map<?, ?>) wood.get(0)).get("id"));
    assertTrue(models.isEmpty());
  }

  @Test
  void downloadResolvesUnderDownloadDirectory() {
    Map<String, Object> result = catalog.download(Map.of("asset_id", "concrete_wall_01"));

    assertEquals("Downloaded", result.get("status"));
    assertEquals("concrete_wall_01", result.get("asset_id"));
    assertEquals(downloads.resolve("concrete_wall_01.blend").toString(), result.get("path"));
  }

  @Test
  void downloadRejectsMissingOrUnsafeIds() {
    assertThrows(IllegalArgumentException.class, () -> catalog.download(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> catalog.download(Map.of("asset_id", "../etc/passwd")));
    assertThrows(IllegalArgumentException.class, () -> catalog.download(Map.of("asset_id", ".hidden")));
  }
}
