package ca.gc.cra.vcr.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"inspect", "-h", "--DEBUG", "--JSON", "cassette=a", "", null});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--json"));
    assertFalse(input.hasFlag("--dry-run"));
    assertArrayEquals(new String[] {"inspect", "cassette=a"}, input.keyValueArgs());
  }

  @Test
  void dashedKeyValuesStayKeyValues() {
    CliInput input = CliInput.parse(new String[] {"-x=1"});

    assertArrayEquals(new String[] {"-x=1"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
    assertFalse(CliInput.parse(null).help());
  }
}
