package ca.gc.cra.vcr.application.replay;

import java.util.List;

/**
 * Outcome of replaying a cassette against a live handler.
 *
 * @param replayed number of interactions re-issued
 * @param mismatches differences found, in interaction order
 * @since 0.1.0
 */
public record ReplayReport(int replayed, List<ReplayMismatch> mismatches) {
  public ReplayReport {
    mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
  }

  /** @return {@code true} when every interaction matched */
  public boolean isSuccess() {
    return mismatches.isEmpty();
  }
}
