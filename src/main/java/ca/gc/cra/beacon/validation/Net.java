package ca.gc.cra.beacon.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Endpoint validation for the feed server URL and the OTLP exporter endpoint.
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3}){3}");
  private static final Pattern LABEL_PATTERN = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?");

  private Net() {}

  /**
   * Validates a WebSocket endpoint ({@code ws://} or {@code wss://}) and returns it as a URI.
   *
   * @param name parameter label used in diagnostics
   * @param value candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException when the scheme, host, or port is invalid
   */
  public static URI validateWebSocketUri(String name, String value) {
    return validateUri(name, value, "ws", "wss");
  }

  /**
   * Validates an HTTP endpoint ({@code http://} or {@code https://}) and returns it as a URI.
   *
   * @param name parameter label used in diagnostics
   * @param value candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException when the scheme, host, or port is invalid
   */
  public static URI validateHttpUri(String name, String value) {
    return validateUri(name, value, "http", "https");
  }

  private static URI validateUri(String name, String value, String plainScheme, String secureScheme) {
    String sanitized = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals(plainScheme) && !scheme.equals(secureScheme)) {
      throw new IllegalArgumentException(
          name + " must use " + plainScheme + " or " + secureScheme + " scheme");
    }
    String host = uri.getHost();
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    checkHost(name, host);
    if (uri.getPort() != -1) {
      Numbers.requireRange(name + " port", uri.getPort(), 1, 65535);
    }
    return uri;
  }

  private static void checkHost(String name, String host) {
    if (host.startsWith("[") && host.endsWith("]")) {
      String literal = host.substring(1, host.length() - 1);
      try {
        if (InetAddress.getByName(literal) instanceof Inet6Address) {
          return;
        }
      } catch (UnknownHostException ex) {
        throw new IllegalArgumentException(name + " has an invalid IPv6 literal: " + literal, ex);
      }
      throw new IllegalArgumentException(name + " has an invalid IPv6 literal: " + literal);
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange(name + " IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(name + " host is longer than " + MAX_HOSTNAME_LENGTH + " characters");
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL_PATTERN.matcher(label).matches()) {
        throw new IllegalArgumentException(name + " host has an invalid label '" + label + "'");
      }
    }
  }
}
