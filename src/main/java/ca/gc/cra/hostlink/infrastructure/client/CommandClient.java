package ca.gc.cra.hostlink.infrastructure.client;

import ca.gc.cra.hostlink.application.port.ProtocolException;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.infrastructure.codec.NdjsonCommandCodec;
import ca.gc.cra.hostlink.infrastructure.net.LineFrameReader;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal blocking client for the command protocol: one request line out, one response line back.
 * <p>Used by {@code hostlink probe} and by integration tests. Not thread-safe; one outstanding request at a time.</p>
 *
 * @since 0.1.0
 */
public final class CommandClient implements AutoCloseable {
  private static final int MAX_RESPONSE_BYTES = 64 * 1024 * 1024;

  private final Socket socket;
  private final NdjsonCommandCodec codec = new NdjsonCommandCodec();
  private final LineFrameReader reader;
  private final OutputStream out;

  private CommandClient(Socket socket) throws IOException {
    this.socket = socket;
    this.reader = new LineFrameReader(new BufferedInputStream(socket.getInputStream()), MAX_RESPONSE_BYTES);
    this.out = new BufferedOutputStream(socket.getOutputStream());
  }

  /**
   * Connects to a server.
   *
   * @param address server address
   * @param timeout connect timeout, also applied as the read timeout
   * @return connected client
   * @throws IOException if the connection fails
   */
  public static CommandClient connect(InetSocketAddress address, Duration timeout) throws IOException {
    Objects.requireNonNull(address, "address");
    int millis = Math.toIntExact(Math.max(1L, timeout.toMillis()));
    Socket socket = new Socket();
    try {
      socket.connect(address, millis);
      socket.setSoTimeout(millis);
      socket.setTcpNoDelay(true);
      return new CommandClient(socket);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
  }

  /**
   * Sends a command and waits for its response.
   *
   * @param command command to send
   * @return decoded response object ({@code error} key on failure)
   * @throws IOException on transport failure, timeout or premature close
   * @throws ProtocolException if the server's reply is not a JSON object
   */
  public Map<String, Object> send(Command command) throws IOException, ProtocolException {
    return sendRaw(codec.encodeCommand(command));
  }

  /**
   * Sends an arbitrary line verbatim and waits for the reply; lets callers exercise malformed input.
   *
   * @param line message body without delimiter
   * @return decoded response object
   * @throws IOException on transport failure, timeout or premature close
   * @throws ProtocolException if the server's reply is not a JSON object
   */
  public Map<String, Object> sendRaw(String line) throws IOException, ProtocolException {
    out.write(line.getBytes(StandardCharsets.UTF_8));
    out.write('\n');
    out.flush();
    String reply = reader.next();
    if (reply == null) {
      throw new EOFException("Server closed the connection before replying");
    }
    return codec.decodeObject(reply);
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
