package ca.gc.cra.hostlink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BridgeConfigTest {

  @Test
  void defaultsMatchTheDocumentedValues() {
    BridgeConfig config = BridgeConfig.fromMap(Map.of());

    assertEquals("localhost", config.host());
    assertEquals(9876, config.port());
    assertEquals(5, config.workers());
    assertEquals(Duration.ofSeconds(30), config.commandTimeout());
    assertEquals(Duration.ofMillis(10), config.tickInterval());
    assertEquals(1024 * 1024, config.maxMessageBytes());
    assertEquals(BridgeConfig.defaults(), config);
  }

  @Test
  void parsesOverrides() {
    BridgeConfig config = BridgeConfig.fromMap(Map.of(
        "host", "0.0.0.0",
        "port", "0",
        "workers", "8",
        "commandTimeoutMs", "1500",
        "tickIntervalMs", "5",
        "maxMessageBytes", "4096",
        "shutdownGraceMs", "0"));

    assertEquals("0.0.0.0", config.host());
    assertEquals(0, config.port());
    assertEquals(8, config.workers());
    assertEquals(Duration.ofMillis(1500), config.commandTimeout());
    assertEquals(Duration.ofMillis(5), config.tickInterval());
    assertEquals(4096, config.maxMessageBytes());
    assertEquals(Duration.ZERO, config.shutdownGrace());
  }

  @Test
  void listenOverridesHostAndPort() {
    BridgeConfig config = BridgeConfig.fromMap(Map.of(
        "host", "localhost",
        "port", "9876",
        "listen", "[::1]:7000"));

    assertEquals("::1", config.host());
    assertEquals(7000, config.port());
  }

  @Test
  void rejectsOutOfRangeValues() {
    IllegalArgumentException workers =
        assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(Map.of("workers", "0")));
    assertTrue(workers.getMessage().contains("workers"));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(Map.of("port", "70000")));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(Map.of("commandTimeoutMs", "0")));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(Map.of("tickIntervalMs", "5000")));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(Map.of("maxMessageBytes", "10")));
  }

  @Test
  void rejectsNonNumericValues() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> BridgeConfig.fromMap(Map.of("commandTimeoutMs", "soon")));
    assertTrue(ex.getMessage().contains("commandTimeoutMs"));
  }

  @Test
  void flatMapFeedsBackIntoFromMap() {
    BridgeConfig original = new BridgeConfig("127.0.0.1", 1234, 3, Duration.ofSeconds(2), Duration.ofMillis(20),
        2048, Duration.ofSeconds(1));

    assertEquals(original, BridgeConfig.fromMap(original.toFlatMap()));
  }
}
