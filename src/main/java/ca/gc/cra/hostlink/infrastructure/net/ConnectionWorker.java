package ca.gc.cra.hostlink.infrastructure.net;

import ca.gc.cra.hostlink.application.dispatch.CommandDispatcher;
import ca.gc.cra.hostlink.application.port.CommandCodec;
import ca.gc.cra.hostlink.application.port.MetricsPort;
import ca.gc.cra.hostlink.application.port.ProtocolException;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.command.ErrorKind;
import ca.gc.cra.hostlink.domain.command.Response;
import ca.gc.cra.hostlink.logging.Logs;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Serves one {@link Connection}: read a line, decode, dispatch, encode, write, repeat.
 * <p><strong>Why:</strong> Keeps each client strictly sequential (response N is written before request N+1 is read)
 * while different clients proceed on different workers.</p>
 * <p><strong>Failure semantics:</strong> Malformed or oversized messages get an error response and the loop
 * continues. Transport failures close the connection without retry.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code conn} to the peer address for the life of the loop.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionWorker implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionWorker.class);

  /** MDC key carrying the remote peer. */
  public static final String MDC_CONNECTION = "conn";
  private static final int LOG_EXCERPT_BYTES = 256;
  private static final byte[] DELIMITER = {'\n'};

  private final Connection connection;
  private final CommandCodec codec;
  private final CommandDispatcher dispatcher;
  private final MetricsPort metrics;
  private final int maxMessageBytes;
  private final Consumer<Connection> onClosed;

  /**
   * Creates a worker for one connection.
   *
   * @param connection accepted connection in state {@link ConnectionState#OPEN}
   * @param codec message codec
   * @param dispatcher command dispatcher
   * @param metrics metrics sink
   * @param maxMessageBytes per-message size limit
   * @param onClosed callback invoked once the connection is closed
   */
  public ConnectionWorker(
      Connection connection,
      CommandCodec codec,
      CommandDispatcher dispatcher,
      MetricsPort metrics,
      int maxMessageBytes,
      Consumer<Connection> onClosed) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.maxMessageBytes = maxMessageBytes;
    this.onClosed = Objects.requireNonNull(onClosed, "onClosed");
  }

  @Override
  public void run() {
    MDC.put(MDC_CONNECTION, connection.peer());
    int served = 0;
    try {
      if (!connection.transition(ConnectionState.AWAITING_MESSAGE)) {
        log.debug("Connection closed before a worker picked it up");
        return;
      }
      log.info("Client connected: {}", connection.peer());
      LineFrameReader reader = new LineFrameReader(
          new BufferedInputStream(connection.socket().getInputStream()), maxMessageBytes);
      OutputStream out = new BufferedOutputStream(connection.socket().getOutputStream());
      while (true) {
        Response response;
        try {
          String message = reader.next();
          if (message == null) {
            log.debug("Peer closed the connection");
            break;
          }
          if (message.isBlank()) {
            continue;
          }
          if (!connection.transition(ConnectionState.DISPATCHING)) {
            break;
          }
          response = handle(message);
        } catch (ProtocolException ex) {
          if (!connection.transition(ConnectionState.DISPATCHING)) {
            break;
          }
          metrics.increment("server.command.error." + ErrorKind.PROTOCOL.metricLabel());
          log.debug("Rejected frame: {}", ex.getMessage());
          response = Response.error(ErrorKind.PROTOCOL, ex.getMessage());
        }
        if (!connection.transition(ConnectionState.WRITING)) {
          break;
        }
        write(out, codec.encode(response));
        served++;
        if (!connection.transition(ConnectionState.AWAITING_MESSAGE)) {
          break;
        }
      }
    } catch (IOException ex) {
      if (connection.isClosed()) {
        log.debug("Connection closed during I/O: {}", ex.getMessage());
      } else {
        metrics.increment("server.connection.transportError");
        log.warn("Transport failure on {}: {}", connection.peer(), ex.getMessage());
      }
    } finally {
      connection.close();
      metrics.increment("server.connection.closed");
      log.info("Client disconnected: {} after {} command(s)", connection.peer(), served);
      onClosed.accept(connection);
      MDC.remove(MDC_CONNECTION);
    }
  }

  private Response handle(String message) {
    Command command;
    try {
      command = codec.decode(message);
    } catch (ProtocolException ex) {
      metrics.increment("server.command.error." + ErrorKind.PROTOCOL.metricLabel());
      log.debug("Rejected message {}: {}", Logs.truncate(message, LOG_EXCERPT_BYTES), ex.getMessage());
      return Response.error(ErrorKind.PROTOCOL, ex.getMessage());
    }
    return dispatcher.dispatch(command);
  }

  private static void write(OutputStream out, String encoded) throws IOException {
    out.write(encoded.getBytes(StandardCharsets.UTF_8));
    out.write(DELIMITER);
    out.flush();
  }
}
