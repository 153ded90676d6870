package ca.gc.cra.hostlink.application.port;

import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.command.Response;

/**
 * <strong>What:</strong> Port converting one framed message into a {@link Command} and a {@link Response} back into
 * one framed message.
 * <p><strong>Why:</strong> Connection workers stay unaware of JSON details; framing and payload encoding can evolve
 * together.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by all connection workers.</p>
 *
 * @since 0.1.0
 */
public interface CommandCodec {
  /**
   * Decodes a single message body (without its delimiter).
   *
   * @param message raw message text
   * @return decoded command
   * @throws ProtocolException when the message is not a well-formed command object
   */
  Command decode(String message) throws ProtocolException;

  /**
   * Encodes a response into a message body that contains no frame delimiter.
   *
   * @param response response to encode
   * @return encoded message body, without the trailing delimiter
   */
  String encode(Response response);
}
