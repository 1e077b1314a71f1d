package ca.gc.cra.vcr.domain.http;

import java.util.Map;

/**
 * Standard reason phrases used to render status lines such as {@code 404 Not Found}.
 *
 * @since 0.1.0
 */
public final class HttpStatusLine {
  private static final Map<Integer, String> REASONS = Map.ofEntries(
      Map.entry(100, "Continue"),
      Map.entry(101, "Switching Protocols"),
      Map.entry(200, "OK"),
      Map.entry(201, "Created"),
      Map.entry(202, "Accepted"),
      Map.entry(203, "Non-Authoritative Information"),
      Map.entry(204, "No Content"),
      Map.entry(205, "Reset Content"),
      Map.entry(206, "Partial Content"),
      Map.entry(300, "Multiple Choices"),
      Map.entry(301, "Moved Permanently"),
      Map.entry(302, "Found"),
      Map.entry(303, "See Other"),
      Map.entry(304, "Not Modified"),
      Map.entry(307, "Temporary Redirect"),
      Map.entry(308, "Permanent Redirect"),
      Map.entry(400, "Bad Request"),
      Map.entry(401, "Unauthorized"),
      Map.entry(403, "Forbidden"),
      Map.entry(404, "Not Found"),
      Map.entry(405, "Method Not Allowed"),
      Map.entry(406, "Not Acceptable"),
      Map.entry(408, "Request Timeout"),
      Map.entry(409, "Conflict"),
      Map.entry(410, "Gone"),
      Map.entry(412, "Precondition Failed"),
      Map.entry(413, "Request Entity Too Large"),
      Map.entry(415, "Unsupported Media Type"),
      Map.entry(418, "I'm a teapot"),
      Map.entry(422, "Unprocessable Entity"),
      Map.entry(429, "Too Many Requests"),
      Map.entry(500, "Internal Server Error"),
      Map.entry(501, "Not Implemented"),
      Map.entry(502, "Bad Gateway"),
      Map.entry(503, "Service Unavailable"),
      Map.entry(504, "Gateway Timeout"));

  private HttpStatusLine() {}

  /**
   * Returns the reason phrase for {@code code}.
   *
   * @param code HTTP status code
   * @return reason phrase, or an empty string for unknown codes
   */
  public static String reason(int code) {
    return REASONS.getOrDefault(code, "");
  }

  /**
   * Formats {@code code} and its reason phrase as a status line.
   *
   * @param code HTTP status code
   * @return {@code "<code> <reason>"}, or just the code when the reason is unknown
   */
  public static String format(int code) {
    String reason = reason(code);
    return reason.isEmpty() ? Integer.toString(code) : code + " " + reason;
  }
}
