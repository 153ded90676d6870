package ca.gc.cra.hostlink.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Host and port validation for listen and probe addresses.
 * <p>Hosts are hostnames, IPv4 dotted quads or IPv6 literals; no DNS lookups are performed for hostnames.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Parsed {@code HOST:PORT} pair.
   *
   * @param host validated host without IPv6 brackets
   * @param port port number
   */
  public record HostPort(String host, int port) {}

  /**
   * Validates a host name or address.
   *
   * @param value hostname, IPv4 literal, or IPv6 literal with or without brackets
   * @return trimmed host without IPv6 brackets
   * @throws IllegalArgumentException if the value is not a valid host
   */
  public static String validateHost(String value) {
    String sanitized = Strings.requireNonBlank("host", value);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      String literal = sanitized.substring(1, sanitized.length() - 1);
      validateIpv6(literal);
      return literal;
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
      return sanitized;
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
    } else {
      validateHostname(sanitized);
    }
    return sanitized;
  }

  /**
   * Parses {@code HOST:PORT}; IPv6 hosts must be bracketed.
   *
   * @param value address text
   * @param allowEphemeral whether port {@code 0} is accepted
   * @return parsed pair
   * @throws IllegalArgumentException if malformed
   */
  public static HostPort parseHostPort(String value, boolean allowEphemeral) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      portPart = sanitized.substring(lastColon + 1);
      host = validateHost(host);
    }
    return new HostPort(host, parsePort(portPart, allowEphemeral));
  }

  /**
   * Parses and range-checks a port number.
   *
   * @param value decimal port text
   * @param allowEphemeral whether {@code 0} is accepted
   * @return port number
   * @throws IllegalArgumentException if not numeric or out of range
   */
  public static int parsePort(String value, boolean allowEphemeral) {
    String trimmed = Strings.requireNonBlank("port", value);
    int port;
    try {
      port = Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + trimmed + ")", ex);
    }
    Numbers.requireRange("port", port, allowEphemeral ? 0 : 1, 65535);
    return port;
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }

  private static void validateIpv6(String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
