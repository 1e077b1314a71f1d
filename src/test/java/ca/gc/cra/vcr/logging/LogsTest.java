package ca.gc.cra.vcr.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValuesAndReportsLength() {
    String shortValue = "hello";
    assertSame(shortValue, Logs.truncate(shortValue, 16));
    assertEquals("<null>", Logs.truncate(null, 16));
    assertEquals("abcd... (truncated, 4 of 10 bytes)", Logs.truncate("abcdefghij", 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void truncateDoesNotSplitMultiByteCharacters() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é... (truncated, 3 of 6 bytes)"), truncated);
  }

  @Test
  void credentialHeadersAreRedacted() {
    Map<String, List<String>> headers = new LinkedHashMap<>();
    headers.put("Authorization", List.of("Bearer secret"));
    headers.put("Set-Cookie", List.of("a=1", "b=2"));
    headers.put("Accept", List.of("text/plain"));

    Map<String, List<String>> printable = Logs.redactHeaders(headers);

    assertEquals(List.of("[REDACTED]"), printable.get("Authorization"));
    assertEquals(List.of("[REDACTED]"), printable.get("Set-Cookie"));
    assertEquals(List.of("text/plain"), printable.get("Accept"));
    assertEquals(List.of("Bearer secret"), headers.get("Authorization"));
    assertTrue(Logs.redactHeaders(null).isEmpty());
  }
}
