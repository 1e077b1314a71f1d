package ca.gc.cra.vcr.config;

import ca.gc.cra.vcr.application.recorder.InvalidModeException;
import ca.gc.cra.vcr.application.recorder.Mode;
import ca.gc.cra.vcr.domain.cassette.ReplayExhaustion;
import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Recorder settings resolved from defaults, YAML, and overrides.
 * <p><strong>Why:</strong> Lets test suites switch between recording and replaying (for example from CI with
 * {@code VCR_MODE=replay-only}) without code changes.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link RecorderFactory}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse the mode and replay-exhaustion policy.</li>
 *   <li>Parse strict boolean toggles and the header ignore list.</li>
 *   <li>Resolve the cassette directory and optional request timeout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param mode recording policy
 * @param cassetteDirectory directory cassette names are resolved against
 * @param replayableInteractions whether an interaction may be replayed any number of times
 * @param blockUnsafeMethods whether non-idempotent methods are refused
 * @param compressionEnabled whether cassettes are gzip-compressed
 * @param simulateLatency whether replays sleep for the recorded duration
 * @param upgradeLegacyCassettes whether cassettes lacking fingerprints are rewritten on open
 * @param replayExhaustion policy once every matching interaction has been replayed
 * @param ignoreHeaders canonical header names excluded from fingerprints
 * @param requestTimeout per-request timeout for the real transport, if any
 * @since 0.1.0
 */
public record RecorderConfig(
    Mode mode,
    Path cassetteDirectory,
    boolean replayableInteractions,
    boolean blockUnsafeMethods,
    boolean compressionEnabled,
    boolean simulateLatency,
    boolean upgradeLegacyCassettes,
    ReplayExhaustion replayExhaustion,
    List<String> ignoreHeaders,
    Optional<Duration> requestTimeout) {

  public RecorderConfig {
    if (mode == null) {
      throw new InvalidModeException("Recorder mode must not be null");
    }
    cassetteDirectory = Objects.requireNonNullElse(cassetteDirectory, Path.of("testdata"));
    replayExhaustion = Objects.requireNonNullElse(replayExhaustion, ReplayExhaustion.REUSE_LAST);
    ignoreHeaders = ignoreHeaders == null ? List.of() : List.copyOf(ignoreHeaders);
    requestTimeout = Objects.requireNonNullElse(requestTimeout, Optional.empty());
    if (requestTimeout.isPresent() && (requestTimeout.get().isNegative() || requestTimeout.get().isZero())) {
      throw new IllegalArgumentException("requestTimeoutMillis must be positive");
    }
  }

  /**
   * Returns the settings used when nothing is configured.
   *
   * @return record-once recorder writing plain cassettes under {@code testdata}
   */
  public static RecorderConfig defaults() {
    return new RecorderConfig(
        Mode.RECORD_ONCE,
        Path.of("testdata"),
        false,
        false,
        false,
        false,
        true,
        ReplayExhaustion.REUSE_LAST,
        List.of(),
        Optional.empty());
  }

  /**
   * Builds settings from flat key/value pairs. Absent keys keep their defaults.
   *
   * <p>Keys: {@code mode}, {@code cassetteDir}, {@code replayableInteractions}, {@code blockUnsafeMethods},
   * {@code compression}, {@code simulateLatency}, {@code upgradeLegacyCassettes}, {@code replayExhaustion},
   * {@code ignoreHeaders} (comma separated), {@code requestTimeoutMillis}.</p>
   *
   * @param options flat settings
   * @return parsed configuration
   * @throws InvalidModeException when the mode is unknown
   * @throws IllegalArgumentException when another value is malformed
   */
  public static RecorderConfig fromMap(Map<String, String> options) {
    Map<String, String> values = options == null ? Map.of() : options;
    RecorderConfig defaults = defaults();
    String rawMode = values.get("mode");
    Mode mode = rawMode == null || rawMode.isBlank() ? defaults.mode() : Mode.parse(rawMode);
    return new RecorderConfig(
        mode,
        parsePath(values.get("cassetteDir"), defaults.cassetteDirectory()),
        Strings.parseBoolean("replayableInteractions", values.get("replayableInteractions"),
            defaults.replayableInteractions()),
        Strings.parseBoolean("blockUnsafeMethods", values.get("blockUnsafeMethods"), defaults.blockUnsafeMethods()),
        Strings.parseBoolean("compression", values.get("compression"), defaults.compressionEnabled()),
        Strings.parseBoolean("simulateLatency", values.get("simulateLatency"), defaults.simulateLatency()),
        Strings.parseBoolean("upgradeLegacyCassettes", values.get("upgradeLegacyCassettes"),
            defaults.upgradeLegacyCassettes()),
        ReplayExhaustion.parse(values.get("replayExhaustion")),
        parseHeaderList(values.get("ignoreHeaders")),
        parseTimeout(values.get("requestTimeoutMillis")));
  }

  /**
   * Renders this configuration as flat key/value pairs understood by {@link #fromMap(Map)}.
   *
   * @return ordered map of settings
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("mode", mode.name());
    map.put("cassetteDir", cassetteDirectory.toString());
    map.put("replayableInteractions", Boolean.toString(replayableInteractions));
    map.put("blockUnsafeMethods", Boolean.toString(blockUnsafeMethods));
    map.put("compression", Boolean.toString(compressionEnabled));
    map.put("simulateLatency", Boolean.toString(simulateLatency));
    map.put("upgradeLegacyCassettes", Boolean.toString(upgradeLegacyCassettes));
    map.put("replayExhaustion", replayExhaustion.name());
    map.put("ignoreHeaders", String.join(",", ignoreHeaders));
    map.put("requestTimeoutMillis", requestTimeout.map(d -> Long.toString(d.toMillis())).orElse(""));
    return map;
  }

  private static Path parsePath(String raw, Path fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("cassetteDir is not a valid path: " + raw, ex);
    }
  }

  private static List<String> parseHeaderList(String raw) {
    List<String> names = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return names;
    }
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        names.add(HttpHeaders.canonicalName(Strings.requireNonBlank("ignoreHeaders", token)));
      }
    }
    return names;
  }

  private static Optional<Duration> parseTimeout(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Duration.ofMillis(Long.parseLong(raw.trim())));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("requestTimeoutMillis must be an integer (was " + raw + ")", ex);
    }
  }
}
