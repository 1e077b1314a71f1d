package ca.gc.cra.vcr.infrastructure.persistence.yaml;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CassetteFileStorageAdapterTest {
  @TempDir Path tempDir;

  @Test
  void writesPlainYamlUnderNestedDirectories() throws IOException {
    CassetteFileStorageAdapter storage = new CassetteFileStorageAdapter(tempDir);

    storage.write("fixtures/api/items", new CassetteDocument(2, false, List.of(YamlCassetteCodecTest.sample())));

    Path file = tempDir.resolve("fixtures/api/items.yaml");
    assertTrue(Files.isRegularFile(file));
    assertTrue(storage.exists("fixtures/api/items", false));
    assertFalse(storage.exists("fixtures/api/items", true));
    assertEquals(file.toString(), storage.location("fixtures/api/items", false));
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals("---", lines.get(0));
    assertEquals("version: 2", lines.get(1));
  }

  @Test
  void compressedCassettesAreGzippedYaml() throws IOException {
    CassetteFileStorageAdapter storage = new CassetteFileStorageAdapter(tempDir);

    storage.write("zipped", new CassetteDocument(2, true, List.of(YamlCassetteCodecTest.sample())));

    Path file = tempDir.resolve("zipped.yaml.gz");
    byte[] raw = Files.readAllBytes(file);
    assertArrayEquals(new byte[] {(byte) 0x1f, (byte) 0x8b}, new byte[] {raw[0], raw[1]});
    try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
      String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      assertTrue(text.startsWith("---\nversion: 2\ncompression_enabled: true\n"));
    }
    CassetteDocument read = storage.read("zipped", true);
    assertEquals(1, read.interactions().size());
    assertEquals("abc123", read.interactions().get(0).fingerprint());
  }

  @Test
  void missingFileIsReportedWithItsLocation() {
    CassetteFileStorageAdapter storage = new CassetteFileStorageAdapter(tempDir);

    CassetteNotFoundException ex = assertThrows(CassetteNotFoundException.class, () -> storage.read("nope", false));
    assertEquals(tempDir.resolve("nope.yaml").toString(), ex.location());
  }

  @Test
  void cassetteSurvivesSaveAndLoadThroughFiles() throws IOException {
    CassetteFileStorageAdapter storage = new CassetteFileStorageAdapter(tempDir);
    Cassette original = Cassette.builder("roundtrip", storage).compressionEnabled(true).build();
    original.addInteraction(YamlCassetteCodecTest.sample());
    original.save();

    Cassette loaded = Cassette.builder("roundtrip", storage).compressionEnabled(true).load();
    HttpRequest replay = HttpRequest.builder("POST", URI.create("https://api.example.test/items?q=1"))
        .header("Content-Type", "application/json")
        .transferEncoding(List.of("chunked"))
        .body("{\"name\":\"box\"}")
        .build();

    assertFalse(loaded.requiresUpgrade());
    assertEquals(201, loaded.getInteraction(replay).response().code());
  }
}
