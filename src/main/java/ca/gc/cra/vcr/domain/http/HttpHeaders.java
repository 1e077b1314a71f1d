package ca.gc.cra.vcr.domain.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Ordered, multi-valued HTTP header map keyed by canonical header names.
 * <p><strong>Why:</strong> Gives fingerprinting and cassette serialization a single, stable view of
 * header names regardless of the casing used on the wire.</p>
 * <p><strong>Role:</strong> Domain value shared by live requests, responses, and recorded snapshots.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; copy before sharing across threads.</p>
 *
 * @implNote Canonical form upper-cases the first letter and every letter following a hyphen and
 * lower-cases the rest ({@code x-request-id} becomes {@code X-Request-Id}). Names containing
 * characters outside the token set are kept verbatim.
 * @since 0.1.0
 */
public final class HttpHeaders {
  private final Map<String, List<String>> values = new LinkedHashMap<>();

  /** Creates an empty header map. */
  public HttpHeaders() {}

  /**
   * Copies a raw name/values map, canonicalizing names and merging duplicates.
   *
   * @param source header map; {@code null} yields an empty map
   * @return new header map
   */
  public static HttpHeaders of(Map<String, ? extends List<String>> source) {
    HttpHeaders headers = new HttpHeaders();
    if (source == null) {
      return headers;
    }
    for (Map.Entry<String, ? extends List<String>> entry : source.entrySet()) {
      if (entry.getKey() == null) {
        continue;
      }
      List<String> list = entry.getValue();
      if (list == null || list.isEmpty()) {
        headers.values.computeIfAbsent(canonicalName(entry.getKey()), k -> new ArrayList<>());
        continue;
      }
      for (String value : list) {
        headers.add(entry.getKey(), value);
      }
    }
    return headers;
  }

  /**
   * Appends a value for {@code name}.
   *
   * @param name header name in any casing
   * @param value header value; {@code null} is stored as an empty string
   * @return this map
   */
  public HttpHeaders add(String name, String value) {
    Objects.requireNonNull(name, "name");
    values.computeIfAbsent(canonicalName(name), k -> new ArrayList<>())
        .add(value == null ? "" : value);
    return this;
  }

  /**
   * Replaces all values for {@code name} with a single value.
   *
   * @param name header name in any casing
   * @param value replacement value
   * @return this map
   */
  public HttpHeaders set(String name, String value) {
    Objects.requireNonNull(name, "name");
    List<String> list = new ArrayList<>();
    list.add(value == null ? "" : value);
    values.put(canonicalName(name), list);
    return this;
  }

  /**
   * Removes every value stored for {@code name}.
   *
   * @param name header name in any casing
   * @return this map
   */
  public HttpHeaders remove(String name) {
    values.remove(canonicalName(name));
    return this;
  }

  /**
   * Returns the first value for {@code name}, or {@code null} when absent.
   *
   * @param name header name in any casing
   * @return first value or {@code null}
   */
  public String first(String name) {
    List<String> list = values.get(canonicalName(name));
    return list == null || list.isEmpty() ? null : list.get(0);
  }

  /**
   * Returns all values stored for {@code name}.
   *
   * @param name header name in any casing
   * @return unmodifiable list; empty when absent
   */
  public List<String> all(String name) {
    List<String> list = values.get(canonicalName(name));
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }

  /**
   * Reports whether {@code name} is present.
   *
   * @param name header name in any casing
   * @return {@code true} when at least an empty entry exists
   */
  public boolean contains(String name) {
    return values.containsKey(canonicalName(name));
  }

  /** @return canonical names in insertion order */
  public Set<String> names() {
    return Collections.unmodifiableSet(values.keySet());
  }

  /** @return {@code true} when no header is present */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Returns a deep, unmodifiable copy of the underlying multimap.
   *
   * @return name to values map preserving insertion order
   */
  public Map<String, List<String>> toMap() {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(copy);
  }

  /** @return deep copy of this header map */
  public HttpHeaders copy() {
    return of(values);
  }

  /**
   * Canonicalizes a header name.
   *
   * @param name raw header name
   * @return canonical header name
   */
  public static String canonicalName(String name) {
    Objects.requireNonNull(name, "name");
    for (int i = 0; i < name.length(); i++) {
      if (!isTokenChar(name.charAt(i))) {
        return name;
      }
    }
    StringBuilder out = new StringBuilder(name.length());
    boolean upper = true;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (upper && c >= 'a' && c <= 'z') {
        c = (char) (c - ('a' - 'A'));
      } else if (!upper && c >= 'A' && c <= 'Z') {
        c = (char) (c + ('a' - 'A'));
      }
      out.append(c);
      upper = c == '-';
    }
    return out.toString();
  }

  private static boolean isTokenChar(char c) {
    if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9') {
      return true;
    }
    return "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HttpHeaders other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
