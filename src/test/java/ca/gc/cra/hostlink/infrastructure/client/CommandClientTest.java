package ca.gc.cra.hostlink.infrastructure.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.hostlink.application.port.ProtocolException;
import ca.gc.cra.hostlink.domain.command.Command;
import java.io.BufferedReader;
import java.io.EOFException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class CommandClientTest {

  @Test
  void sendsOneLineAndParsesTheReply() throws Exception {
    AtomicReference<String> received = new AtomicReference<>();
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Thread peer = serveOnce(server, received, "{\"status\":\"ok\"}\n");

      try (CommandClient client = CommandClient.connect(address(server), Duration.ofSeconds(5))) {
        assertEquals(Map.of("status", "ok"), client.send(new Command("get_object_info", Map.of("name", "Cube"))));
      }
      peer.join(5_000);
    }
    assertEquals("{\"tool\":\"get_object_info\",\"params\":{\"name\":\"Cube\"}}", received.get());
  }

  @Test
  void closedConnectionWithoutReplyIsEof() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Thread peer = serveOnce(server, new AtomicReference<>(), "");

      try (CommandClient client = CommandClient.connect(address(server), Duration.ofSeconds(5))) {
        assertThrows(EOFException.class, () -> client.send(Command.of("get_scene_info")));
      }
      peer.join(5_000);
    }
  }

  @Test
  void nonObjectReplyIsAProtocolError() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Thread peer = serveOnce(server, new AtomicReference<>(), "[1,2,3]\n");

      try (CommandClient client = CommandClient.connect(address(server), Duration.ofSeconds(5))) {
        assertThrows(ProtocolException.class, () -> client.send(Command.of("get_scene_info")));
      }
      peer.join(5_000);
    }
  }

  private static InetSocketAddress address(ServerSocket server) {
    return new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort());
  }

  private static Thread serveOnce(ServerSocket server, AtomicReference<String> received, String reply) {
    Thread thread = new Thread(() -> {
      try (Socket socket = server.accept()) {
        BufferedReader reader =
            new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        received.set(reader.readLine());
        OutputStream out = socket.getOutputStream();
        out.write(reply.getBytes(StandardCharsets.UTF_8));
        out.flush();
      } catch (Exception ex) {
        throw new IllegalStateException(ex);
      }
    }, "fake-server");
    thread.start();
    return thread;
  }
}
