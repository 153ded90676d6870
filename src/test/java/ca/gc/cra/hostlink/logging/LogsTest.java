package ca.gc.cra.hostlink.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;
import java.net.Socket;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    String value = "{\"tool\":\"get_scene_info\"}";
    assertSame(value, Logs.truncate(value, 64));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void longValuesAreCutOnCharacterBoundaries() {
    String truncated = Logs.truncate("ééééé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
    assertTrue(truncated.contains("3 of 10 bytes"), truncated);
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void peerFormatsAddresses() {
    assertEquals("127.0.0.1:9876", Logs.peer(new InetSocketAddress("127.0.0.1", 9876)));
    assertEquals("<unknown>", Logs.peer(new Socket()));
    assertEquals("<unknown>", Logs.peer((Socket) null));
  }
}
