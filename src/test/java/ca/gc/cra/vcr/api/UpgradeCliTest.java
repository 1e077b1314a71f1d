package ca.gc.cra.vcr.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.infrastructure.persistence.yaml.CassetteFileStorageAdapter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UpgradeCliTest {
  private static final String EXPORTER_PROPERTY = "otel.metrics.exporter";

  @TempDir Path tempDir;

  private StringWriter buffer;
  private String previousExporter;

  @BeforeEach
  void setUp() {
    previousExporter = System.getProperty(EXPORTER_PROPERTY);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (previousExporter == null) {
      System.clearProperty(EXPORTER_PROPERTY);
    } else {
      System.setProperty(EXPORTER_PROPERTY, previousExporter);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunReportsWithoutWriting() throws Exception {
    Path file = CassetteFixtures.legacy(tempDir, "dry", "http://svc.test/a", "a");
    String before = Files.readString(file);

    ExitCode code = UpgradeCli.run(new String[] {"cassette=" + file, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(": upgrade required"), buffer.toString());
    assertEquals(before, Files.readString(file));
    assertEquals("none", System.getProperty(EXPORTER_PROPERTY));
  }

  @Test
  void upgradesLegacyCassetteOnce() throws Exception {
    Path file = CassetteFixtures.legacy(tempDir, "old", "http://svc.test/a", "a", "http://svc.test/b", "b");

    assertEquals(ExitCode.SUCCESS, UpgradeCli.run(new String[] {"cassette=" + file}));
    assertEquals(ExitCode.SUCCESS, UpgradeCli.run(new String[] {"cassette=" + file}));

    String output = buffer.toString();
    assertTrue(output.contains(": upgraded 2 interactions"), output);
    assertTrue(output.contains(": already up to date"), output);
    Cassette reloaded = Cassette.builder("old", new CassetteFileStorageAdapter(tempDir)).load();
    assertFalse(reloaded.requiresUpgrade());
  }

  @Test
  void invalidExporterIsRejected() throws Exception {
    Path file = CassetteFixtures.legacy(tempDir, "bad", "http://svc.test/a", "a");

    ExitCode code = UpgradeCli.run(new String[] {"cassette=" + file, "metricsExporter=prometheus"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: upgrade"));
  }
}
