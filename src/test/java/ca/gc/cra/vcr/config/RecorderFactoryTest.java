package ca.gc.cra.vcr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.application.recorder.Mode;
import ca.gc.cra.vcr.application.recorder.Recorder;
import ca.gc.cra.vcr.application.recorder.UnsafeMethodException;
import ca.gc.cra.vcr.domain.fingerprint.DefaultRequestFingerprinter;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.infrastructure.transport.JdkHttpTransport;
import ca.gc.cra.vcr.support.InMemoryCassetteStorage;
import ca.gc.cra.vcr.support.ScriptedTransport;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecorderFactoryTest {
  @TempDir Path tempDir;
  private String previousMode;

  @AfterEach
  void restoreMode() {
    if (previousMode == null) {
      System.clearProperty(ConfigMerger.MODE_PROPERTY);
    } else {
      System.setProperty(ConfigMerger.MODE_PROPERTY, previousMode);
    }
  }

  @Test
  void loadConfigLayersYamlEnvironmentAndOverrides() throws IOException {
    previousMode = System.getProperty(ConfigMerger.MODE_PROPERTY);
    System.setProperty(ConfigMerger.MODE_PROPERTY, "replay-only");
    Path yaml = tempDir.resolve("vcr.yaml");
    Files.writeString(yaml, """
        common:
          mode: record_only
          compression: true
          ignoreHeaders: [User-Agent]
        """);

    RecorderConfig fromEnvironment = RecorderFactory.loadConfig(yaml, "local", Map.of());
    RecorderConfig overridden = RecorderFactory.loadConfig(yaml, "local", Map.of("mode", "passthrough"));

    assertEquals(Mode.REPLAY_ONLY, fromEnvironment.mode());
    assertTrue(fromEnvironment.compressionEnabled());
    assertEquals(Mode.PASSTHROUGH, overridden.mode());
    assertTrue(overridden.upgradeLegacyCassettes());
  }

  @Test
  void loadConfigWithoutYamlUsesDefaults() throws IOException {
    previousMode = System.getProperty(ConfigMerger.MODE_PROPERTY);
    System.clearProperty(ConfigMerger.MODE_PROPERTY);

    RecorderConfig config = RecorderFactory.loadConfig(null, "local", Map.of("cassetteDir", "fixtures"));

    assertEquals(Path.of("fixtures"), config.cassetteDirectory());
    assertFalse(config.compressionEnabled());
  }

  @Test
  void builderAppliesConfiguration() throws Exception {
    RecorderConfig config = RecorderConfig.fromMap(Map.of(
        "mode", "record_once", "blockUnsafeMethods", "true", "ignoreHeaders", "user-agent"));
    InMemoryCassetteStorage storage = new InMemoryCassetteStorage();
    ScriptedTransport transport = new ScriptedTransport();
    RecorderFactory factory = new RecorderFactory(config, storage, transport, MetricsPort.NO_OP);

    Recorder recorder = factory.open("factory");
    recorder.perform(HttpRequest.builder("GET", URI.create("http://svc.test/x")).header("User-Agent", "a").build());
    assertThrows(UnsafeMethodException.class,
        () -> recorder.perform(HttpRequest.builder("POST", URI.create("http://svc.test/x")).build()));
    recorder.stop();

    Recorder replayer = factory.builder("factory").mode(Mode.REPLAY_ONLY).build();
    replayer.perform(HttpRequest.builder("GET", URI.create("http://svc.test/x")).header("User-Agent", "b").build());

    assertSame(transport, recorder.realTransport());
    assertEquals(1, transport.calls());
    assertEquals(Set.of("User-Agent"),
        ((DefaultRequestFingerprinter) factory.fingerprinter()).ignoredHeaders());
    assertSame(config, factory.config());
  }

  @Test
  void defaultWiringWritesUnderTheCassetteDirectory() throws Exception {
    RecorderConfig config = RecorderConfig.fromMap(Map.of(
        "mode", "record_only", "cassetteDir", tempDir.resolve("cassettes").toString(), "requestTimeoutMillis", "500"));
    RecorderFactory factory = new RecorderFactory(config, MetricsPort.NO_OP);

    Recorder recorder = factory.open("empty");
    recorder.stop();

    assertTrue(Files.isRegularFile(tempDir.resolve("cassettes/empty.yaml")));
    assertTrue(recorder.realTransport() instanceof JdkHttpTransport);
    assertSame(DefaultRequestFingerprinter.standard(), factory.fingerprinter());
  }
}
