package ca.gc.cra.vcr.domain.cassette;

import java.util.Locale;

/**
 * Policy applied when every interaction recorded for a fingerprint has already been replayed and replay reuse is
 * disabled.
 *
 * @since 0.1.0
 */
public enum ReplayExhaustion {
  /** Return the most recently replayed interaction again and log a warning. */
  REUSE_LAST,
  /** Fail the lookup with {@link InteractionNotFoundException}. */
  FAIL;

  /**
   * Parses a policy name case-insensitively; hyphens are accepted in place of underscores.
   *
   * @param raw policy name; {@code null} or blank yields {@link #REUSE_LAST}
   * @return parsed policy
   * @throws IllegalArgumentException for unknown names
   */
  public static ReplayExhaustion parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return REUSE_LAST;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("replayExhaustion must be REUSE_LAST or FAIL (was " + raw + ")", ex);
    }
  }
}
