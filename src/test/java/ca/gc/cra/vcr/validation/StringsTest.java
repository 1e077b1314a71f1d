package ca.gc.cra.vcr.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Strings.parseBoolean("flag", " TRUE ", false));
    assertFalse(Strings.parseBoolean("flag", "false", true));
    assertTrue(Strings.parseBoolean("flag", null, true));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.parseBoolean("flag", "yes", false));
    assertEquals("flag must be true or false (was yes)", ex.getMessage());
  }
}
