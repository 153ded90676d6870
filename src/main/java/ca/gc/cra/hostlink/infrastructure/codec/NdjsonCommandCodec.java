package ca.gc.cra.hostlink.infrastructure.codec;

import ca.gc.cra.hostlink.application.port.CommandCodec;
import ca.gc.cra.hostlink.application.port.ProtocolException;
import ca.gc.cra.hostlink.domain.command.Command;
import ca.gc.cra.hostlink.domain.command.Response;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link CommandCodec} for newline-delimited JSON: one request object per line in, one
 * response object per line out.
 * <p><strong>Why:</strong> Jackson's streaming API keeps the codec free of data-binding and escapes control
 * characters, so an encoded response never contains the newline delimiter.</p>
 * <p><strong>Request shape:</strong> {@code {"tool": string, "params": object}}. {@code params} may be omitted. The
 * legacy {@code "type"} key is accepted when {@code "tool"} is absent.</p>
 * <p><strong>Thread-safety:</strong> The shared {@link JsonFactory} is thread-safe; parsers and generators are
 * created per call.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonCommandCodec implements CommandCodec {
  static final String TOOL_FIELD = "tool";
  static final String LEGACY_TOOL_FIELD = "type";
  static final String PARAMS_FIELD = "params";
  static final String ERROR_FIELD = "error";

  private final JsonFactory factory = new JsonFactory();

  @Override
  public Command decode(String message) throws ProtocolException {
    Objects.requireNonNull(message, "message");
    Map<String, Object> root;
    try (JsonParser parser = factory.createParser(message)) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        throw new ProtocolException("Invalid JSON: empty message");
      }
      if (first != JsonToken.START_OBJECT) {
        throw new ProtocolException("Invalid command: expected a JSON object");
      }
      root = readObject(parser);
      if (parser.nextToken() != null) {
        throw new ProtocolException("Invalid JSON: trailing content after command object");
      }
    } catch (JsonProcessingException ex) {
      throw new ProtocolException("Invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new ProtocolException("Invalid JSON: " + ex.getMessage(), ex);
    }
    return toCommand(root);
  }

  @Override
  public String encode(Response response) {
    Objects.requireNonNull(response, "response");
    StringWriter out = new StringWriter(128);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      if (response.isError()) {
        generator.writeStringField(ERROR_FIELD, response.error());
      } else {
        for (Map.Entry<String, Object> entry : response.payload().entrySet()) {
          generator.writeFieldName(entry.getKey());
          writeValue(generator, entry.getValue());
        }
      }
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode response", ex);
    }
    return out.toString();
  }

  /**
   * Encodes a request line as a client sends it. Used by the probe client.
   *
   * @param command command to send
   * @return encoded message body, without the trailing delimiter
   */
  public String encodeCommand(Command command) {
    Objects.requireNonNull(command, "command");
    StringWriter out = new StringWriter(64);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField(TOOL_FIELD, command.tool());
      generator.writeFieldName(PARAMS_FIELD);
      writeValue(generator, command.params());
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode command", ex);
    }
    return out.toString();
  }

  /**
   * Parses a single JSON object, such as a response line or a {@code params} argument.
   *
   * @param text JSON text
   * @return parsed object with insertion-ordered keys
   * @throws ProtocolException if {@code text} is not exactly one JSON object
   */
  public Map<String, Object> decodeObject(String text) throws ProtocolException {
    Objects.requireNonNull(text, "text");
    try (JsonParser parser = factory.createParser(text)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new ProtocolException("Invalid JSON: expected an object");
      }
      Map<String, Object> value = readObject(parser);
      if (parser.nextToken() != null) {
        throw new ProtocolException("Invalid JSON: trailing content after object");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new ProtocolException("Invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new ProtocolException("Invalid JSON: " + ex.getMessage(), ex);
    }
  }

  private static Command toCommand(Map<String, Object> root) throws ProtocolException {
    Object tool = root.containsKey(TOOL_FIELD) ? root.get(TOOL_FIELD) : root.get(LEGACY_TOOL_FIELD);
    if (tool == null) {
      throw new ProtocolException("Invalid command: missing 'tool'");
    }
    if (!(tool instanceof String name)) {
      throw new ProtocolException("Invalid command: 'tool' must be a string");
    }
    if (name.isBlank()) {
      throw new ProtocolException("Invalid command: 'tool' must not be blank");
    }
    Object params = root.get(PARAMS_FIELD);
    if (params == null) {
      return Command.of(name);
    }
    if (!(params instanceof Map<?, ?>)) {
      throw new ProtocolException("Invalid command: 'params' must be an object");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> typed = (Map<String, Object>) params;
    return new Command(name, typed);
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new JsonParseException(parser, "Unexpected end of input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new JsonParseException(parser, "Unexpected token " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token = parser.nextToken();
    while (token != JsonToken.END_OBJECT) {
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
      token = parser.nextToken();
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token = parser.nextToken();
    while (token != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
      token = parser.nextToken();
    }
    return list;
  }

  private static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof CharSequence text) {
      generator.writeString(text.toString());
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof Number number) {
      double d = number.doubleValue();
      if (Double.isFinite(d)) {
        generator.writeNumber(d);
      } else {
        // NaN and the infinities have no JSON literal
        generator.writeNull();
      }
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof byte[] bytes) {
      generator.writeBinary(bytes);
    } else if (value instanceof Object[] array) {
      generator.writeStartArray();
      for (Object item : array) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof Enum<?> constant) {
      generator.writeString(constant.name());
    } else {
      generator.writeString(value.toString());
    }
  }
}
