package ca.gc.cra.vcr.domain.cassette;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Copy helpers that keep recorded snapshots deeply immutable. */
final class Snapshots {
  private Snapshots() {}

  static Map<String, List<String>> copy(Map<String, List<String>> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : source.entrySet()) {
      if (entry.getKey() == null) {
        continue;
      }
      copy.put(entry.getKey(), copy(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  static List<String> copy(List<String> source) {
    if (source == null || source.isEmpty()) {
      return List.of();
    }
    List<String> values = new ArrayList<>(source.size());
    for (String value : source) {
      values.add(value == null ? "" : value);
    }
    return List.copyOf(values);
  }

  static String text(String value) {
    return value == null ? "" : value;
  }

  static byte[] bytes(byte[] value) {
    return value == null ? new byte[0] : Arrays.copyOf(value, value.length);
  }

  static byte[] utf8(String value) {
    return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Reports whether the bytes decode as UTF-8 without replacement characters.
   *
   * @param value candidate bytes
   * @return {@code true} when a UTF-8 text form round-trips to the same bytes
   */
  static boolean isUtf8(byte[] value) {
    try {
      StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(value));
      return true;
    } catch (CharacterCodingException ex) {
      return false;
    }
  }
}
