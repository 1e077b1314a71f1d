package ca.gc.cra.vcr.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"cassette=testdata/a", "target=http://h/x?y=1"});
    assertEquals("testdata/a", map.get("cassette"));
    assertEquals("http://h/x?y=1", map.get("target"));
  }

  @Test
  void rejectsMalformedArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0007b"}));
  }

  @Test
  void laterDuplicatesWinAndBlanksAreSkipped() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"mode=a", " ", null, "mode=b"});
    assertEquals(Map.of("mode", "b"), map);
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
