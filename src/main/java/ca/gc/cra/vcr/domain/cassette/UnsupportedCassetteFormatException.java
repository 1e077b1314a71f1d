package ca.gc.cra.vcr.domain.cassette;

import java.io.IOException;

/**
 * Signals a cassette whose format version differs from {@link CassetteFormat#VERSION}.
 *
 * @since 0.1.0
 */
public final class UnsupportedCassetteFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int foundVersion;

  /**
   * Creates the exception.
   *
   * @param location cassette location
   * @param foundVersion version read from the file
   */
  public UnsupportedCassetteFormatException(String location, int foundVersion) {
    super("Unsupported cassette version format in " + location + ": found version " + foundVersion
        + ", but reader supports version " + CassetteFormat.VERSION);
    this.foundVersion = foundVersion;
  }

  /** @return version read from the file */
  public int foundVersion() {
    return foundVersion;
  }
}
