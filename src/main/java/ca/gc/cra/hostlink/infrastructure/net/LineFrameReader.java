package ca.gc.cra.hostlink.infrastructure.net;

import ca.gc.cra.hostlink.application.port.ProtocolException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Splits an input stream into newline-terminated UTF-8 messages with a per-message byte limit.
 * <p>A trailing {@code \r} is stripped and does not count toward the limit. A message longer than the limit is
 * skipped through its terminating newline and reported once as a {@link ProtocolException}, leaving the stream
 * positioned at the next message. Bytes that are not valid UTF-8 are rejected the same way.</p>
 * <p>Not thread-safe; owned by a single connection worker.</p>
 *
 * @since 0.1.0
 */
public final class LineFrameReader {
  private static final int LF = '\n';
  private static final int CR = '\r';

  private final InputStream in;
  private final int maxMessageBytes;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);

  /**
   * Creates a reader.
   *
   * @param in source stream; should be buffered
   * @param maxMessageBytes largest accepted message, excluding the delimiter
   */
  public LineFrameReader(InputStream in, int maxMessageBytes) {
    this.in = Objects.requireNonNull(in, "in");
    if (maxMessageBytes <= 0) {
      throw new IllegalArgumentException("maxMessageBytes must be positive");
    }
    this.maxMessageBytes = maxMessageBytes;
  }

  /**
   * Reads the next message.
   *
   * @return message text without its delimiter, or {@code null} at end of stream. Bytes left without a final
   *     newline when the peer closes are returned as a last message.
   * @throws ProtocolException if the message exceeded the limit or is not valid UTF-8; it has been discarded
   * @throws IOException on transport failure
   */
  public String next() throws IOException, ProtocolException {
    buffer.reset();
    while (true) {
      int b = in.read();
      if (b < 0) {
        return buffer.size() == 0 ? null : decode();
      }
      if (b == LF) {
        return decode();
      }
      // one CR past the limit may still be the line ending
      if (buffer.size() >= maxMessageBytes && !(b == CR && buffer.size() == maxMessageBytes)) {
        discardThroughNewline();
        throw new ProtocolException("Message too large: limit " + maxMessageBytes + " bytes");
      }
      buffer.write(b);
    }
  }

  private void discardThroughNewline() throws IOException {
    buffer.reset();
    int b;
    do {
      b = in.read();
    } while (b >= 0 && b != LF);
  }

  private String decode() throws ProtocolException {
    byte[] bytes = buffer.toByteArray();
    int length = bytes.length;
    if (length > 0 && bytes[length - 1] == CR) {
      length--;
    }
    try {
      return decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
    } catch (CharacterCodingException ex) {
      throw new ProtocolException("Invalid JSON: malformed UTF-8", ex);
    }
  }
}
