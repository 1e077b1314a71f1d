package ca.gc.cra.vcr.api;

/**
 * <strong>What:</strong> Process exit codes shared by the cassette command-line tools.
 * <p><strong>Why:</strong> Scripts and CI jobs branch on the outcome of {@code inspect}, {@code upgrade}, and
 * {@code verify}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Replay verification found mismatches. */
  VERIFY_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A cassette or configuration file could not be read or written. */
  IO_ERROR(3),
  /** A cassette was readable but not usable, such as an unsupported format version. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric process status */
  public int code() {
    return code;
  }
}
