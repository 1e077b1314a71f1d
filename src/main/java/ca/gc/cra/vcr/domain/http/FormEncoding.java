package ca.gc.cra.vcr.domain.http;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helpers for {@code application/x-www-form-urlencoded} payloads.
 *
 * @since 0.1.0
 */
public final class FormEncoding {
  /** Media type of urlencoded form bodies. */
  public static final String MEDIA_TYPE = "application/x-www-form-urlencoded";

  private FormEncoding() {}

  /**
   * Parses an urlencoded string into an ordered multimap.
   *
   * @param encoded form payload; {@code null} or empty yields an empty map
   * @return ordered name to values map
   * @throws IllegalArgumentException when a percent escape is malformed
   */
  public static Map<String, List<String>> parse(String encoded) {
    Map<String, List<String>> form = new LinkedHashMap<>();
    if (encoded == null || encoded.isEmpty()) {
      return form;
    }
    for (String pair : encoded.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int idx = pair.indexOf('=');
      String key = idx < 0 ? pair : pair.substring(0, idx);
      String value = idx < 0 ? "" : pair.substring(idx + 1);
      form.computeIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8), k -> new ArrayList<>())
          .add(URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return form;
  }

  /**
   * Encodes a multimap as an urlencoded string with keys in sorted order.
   *
   * @param form name to values map; {@code null} yields an empty string
   * @return encoded payload
   */
  public static String encode(Map<String, List<String>> form) {
    if (form == null || form.isEmpty()) {
      return "";
    }
    List<String> keys = new ArrayList<>(form.keySet());
    Collections.sort(keys);
    StringJoiner joiner = new StringJoiner("&");
    for (String key : keys) {
      for (String value : form.getOrDefault(key, List.of())) {
        joiner.add(URLEncoder.encode(key, StandardCharsets.UTF_8)
            + '=' + URLEncoder.encode(value, StandardCharsets.UTF_8));
      }
    }
    return joiner.toString();
  }

  /**
   * Reports whether a {@code Content-Type} value denotes an urlencoded form.
   *
   * @param contentType header value; may be {@code null}
   * @return {@code true} for urlencoded forms, ignoring parameters such as charset
   */
  public static boolean isFormContentType(String contentType) {
    if (contentType == null) {
      return false;
    }
    int semicolon = contentType.indexOf(';');
    String media = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
    return media.trim().toLowerCase(Locale.ROOT).equals(MEDIA_TYPE);
  }
}
