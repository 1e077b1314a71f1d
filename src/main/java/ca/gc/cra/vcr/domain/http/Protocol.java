package ca.gc.cra.vcr.domain.http;

import java.util.Objects;

/**
 * HTTP protocol version as carried on the request or status line.
 *
 * @param name protocol token such as {@code HTTP/1.1}; never {@code null}
 * @param major major version number
 * @param minor minor version number
 * @since 0.1.0
 */
public record Protocol(String name, int major, int minor) {
  /** HTTP/1.0. */
  public static final Protocol HTTP_1_0 = new Protocol("HTTP/1.0", 1, 0);
  /** HTTP/1.1. */
  public static final Protocol HTTP_1_1 = new Protocol("HTTP/1.1", 1, 1);
  /** HTTP/2.0. */
  public static final Protocol HTTP_2 = new Protocol("HTTP/2.0", 2, 0);

  public Protocol {
    name = Objects.requireNonNullElse(name, "");
  }

  /**
   * Parses an {@code HTTP/major.minor} token.
   *
   * @param raw protocol token; {@code null} or blank defaults to HTTP/1.1
   * @return parsed protocol
   * @throws IllegalArgumentException when the token is not of the form {@code HTTP/x.y}
   */
  public static Protocol parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return HTTP_1_1;
    }
    String value = raw.trim();
    if (!value.startsWith("HTTP/")) {
      throw new IllegalArgumentException("Unsupported protocol token: " + raw);
    }
    String version = value.substring("HTTP/".length());
    int dot = version.indexOf('.');
    try {
      if (dot < 0) {
        return new Protocol(value, Integer.parseInt(version), 0);
      }
      return new Protocol(
          value,
          Integer.parseInt(version.substring(0, dot)),
          Integer.parseInt(version.substring(dot + 1)));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Malformed protocol version: " + raw, ex);
    }
  }
}
