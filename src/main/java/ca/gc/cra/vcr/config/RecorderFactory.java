package ca.gc.cra.vcr.config;

import ca.gc.cra.vcr.application.port.CassetteStoragePort;
import ca.gc.cra.vcr.application.port.HttpTransport;
import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.application.recorder.Recorder;
import ca.gc.cra.vcr.domain.fingerprint.DefaultRequestFingerprinter;
import ca.gc.cra.vcr.domain.fingerprint.RequestFingerprinter;
import ca.gc.cra.vcr.infrastructure.persistence.yaml.CassetteFileStorageAdapter;
import ca.gc.cra.vcr.infrastructure.transport.JdkHttpTransport;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root turning a {@link RecorderConfig} into ready-to-use recorders.
 * <p><strong>Why:</strong> Keeps adapter selection (file storage, JDK transport, metrics) in one place so tests only
 * name a cassette.</p>
 * <p><strong>Role:</strong> Configuration-layer factory spanning application and infrastructure.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the fingerprinter from the header ignore list.</li>
 *   <li>Wire file storage under the configured cassette directory.</li>
 *   <li>Supply the JDK transport unless a transport is given explicitly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #builder(String)} returns a fresh builder per call.</p>
 *
 * @since 0.1.0
 */
public final class RecorderFactory {
  private static final Logger log = LoggerFactory.getLogger(RecorderFactory.class);

  private final RecorderConfig config;
  private final CassetteStoragePort storage;
  private final HttpTransport transport;
  private final MetricsPort metrics;

  /**
   * Creates a factory over file storage and the JDK transport.
   *
   * @param config recorder settings
   * @param metrics metrics sink shared by created recorders
   */
  public RecorderFactory(RecorderConfig config, MetricsPort metrics) {
    this(config, new CassetteFileStorageAdapter(config.cassetteDirectory()), defaultTransport(config), metrics);
  }

  /**
   * Creates a factory with explicit adapters.
   *
   * @param config recorder settings
   * @param storage cassette storage
   * @param transport real transport
   * @param metrics metrics sink
   */
  public RecorderFactory(
      RecorderConfig config, CassetteStoragePort storage, HttpTransport transport, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Loads settings from an optional YAML file, the {@code vcr.mode} / {@code VCR_MODE} environment override, and
   * explicit overrides, in increasing precedence.
   *
   * @param yamlPath YAML file; may be {@code null} or missing
   * @param profile profile section overlaid on {@code common}
   * @param overrides explicit overrides; may be empty
   * @return resolved configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when a value is malformed
   */
  public static RecorderConfig loadConfig(Path yamlPath, String profile, Map<String, String> overrides)
      throws IOException {
    Optional<Map<String, String>> yaml = yamlPath == null ? Optional.empty() : YamlConfigLoader.load(yamlPath, profile);
    Map<String, String> withEnvironment = ConfigMerger.buildEffectiveConfig(
        profile, yaml, ConfigMerger.environmentOverrides(), RecorderConfig.defaults().toFlatMap(), log::warn);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        profile, Optional.of(withEnvironment), overrides, Map.of(), log::warn);
    return RecorderConfig.fromMap(effective);
  }

  /** @return settings this factory applies */
  public RecorderConfig config() {
    return config;
  }

  /**
   * Returns a builder preconfigured from the settings; callers may add hooks or passthroughs before building.
   *
   * @param cassetteName cassette name relative to the cassette directory
   * @return recorder builder
   */
  public Recorder.Builder builder(String cassetteName) {
    return Recorder.builder(cassetteName, storage)
        .mode(config.mode())
        .realTransport(transport)
        .fingerprinter(fingerprinter())
        .blockUnsafeMethods(config.blockUnsafeMethods())
        .replayableInteractions(config.replayableInteractions())
        .replayExhaustion(config.replayExhaustion())
        .compressionEnabled(config.compressionEnabled())
        .simulateLatency(config.simulateLatency())
        .upgradeLegacyCassettes(config.upgradeLegacyCassettes())
        .metrics(metrics);
  }

  /**
   * Opens a recorder over the named cassette.
   *
   * @param cassetteName cassette name relative to the cassette directory
   * @return started recorder
   * @throws IOException when the cassette cannot be opened
   */
  public Recorder open(String cassetteName) throws IOException {
    Recorder recorder = builder(cassetteName).build();
    log.debug("Opened recorder for {} in mode {}", cassetteName, config.mode());
    return recorder;
  }

  /**
   * Builds the fingerprinter described by the header ignore list.
   *
   * @return fingerprinter
   */
  public RequestFingerprinter fingerprinter() {
    if (config.ignoreHeaders().isEmpty()) {
      return DefaultRequestFingerprinter.standard();
    }
    return DefaultRequestFingerprinter.builder().ignoreHeaders(config.ignoreHeaders()).build();
  }

  private static HttpTransport defaultTransport(RecorderConfig config) {
    HttpClient client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
    return new JdkHttpTransport(client, config.requestTimeout().orElse(null));
  }
}
