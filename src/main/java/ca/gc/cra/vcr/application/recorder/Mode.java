package ca.gc.cra.vcr.application.recorder;

import java.util.Locale;

/**
 * Recording policy fixed for the lifetime of a recorder.
 *
 * @since 0.1.0
 */
public enum Mode {
  /** Records when the cassette is new; otherwise replays only. Decided once, when the cassette is opened. */
  RECORD_ONCE,
  /** Starts a fresh cassette and sends every request to the real transport, capturing the results. */
  RECORD_ONLY,
  /** Replays from an existing cassette; a miss is an error and the real transport is never used. */
  REPLAY_ONLY,
  /** Replays when possible and records misses so the cassette grows across runs. */
  REPLAY_WITH_NEW_EPISODES,
  /** Forwards every request to the real transport without lookups or captures. */
  PASSTHROUGH;

  /**
   * Parses a mode name, ignoring case, hyphens, and underscores ({@code record-once}, {@code RecordOnce}).
   *
   * @param raw mode name
   * @return parsed mode
   * @throws InvalidModeException when the name is missing or unknown
   */
  public static Mode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidModeException("Recorder mode must not be blank");
    }
    String wanted = normalize(raw);
    for (Mode mode : values()) {
      if (normalize(mode.name()).equals(wanted)) {
        return mode;
      }
    }
    throw new InvalidModeException("Invalid recorder mode: " + raw);
  }

  private static String normalize(String value) {
    return value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
  }
}
