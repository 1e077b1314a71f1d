package ca.gc.cra.vcr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void profileSectionOverridesCommon() throws IOException {
    Path file = tempDir.resolve("vcr.yaml");
    Files.writeString(file, """
        common:
          mode: record_once
          cassetteDir: testdata
          ignoreHeaders:
            - User-Agent
            - X-Request-Id
        CI:
          mode: replay_only
          otel:
            endpoint: http://collector:4317
        """);

    Map<String, String> values = YamlConfigLoader.load(file, "ci").orElseThrow();

    assertEquals("replay_only", values.get("mode"));
    assertEquals("testdata", values.get("cassetteDir"));
    assertEquals("User-Agent,X-Request-Id", values.get("ignoreHeaders"));
    assertEquals("http://collector:4317", values.get("otel.endpoint"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "ci"));
  }

  @Test
  void emptyFileYieldsNoValues() throws IOException {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "");

    assertTrue(YamlConfigLoader.load(file, "common").orElseThrow().isEmpty());
  }

  @Test
  void nestedListsAndBadDocumentsAreRejected() throws IOException {
    Path nested = tempDir.resolve("nested.yaml");
    Files.writeString(nested, "common:\n  ignoreHeaders:\n    - [a, b]\n");
    Path scalar = tempDir.resolve("scalar.yaml");
    Files.writeString(scalar, "common: 5\n");
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "common: [\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nested, "common"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "common"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "common"));
  }
}
