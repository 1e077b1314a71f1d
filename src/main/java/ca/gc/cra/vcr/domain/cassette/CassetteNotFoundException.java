package ca.gc.cra.vcr.domain.cassette;

import java.io.IOException;

/**
 * Signals that the backing file of a cassette does not exist.
 *
 * @since 0.1.0
 */
public final class CassetteNotFoundException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String location;

  /**
   * Creates the exception.
   *
   * @param location path or URI that was looked up
   */
  public CassetteNotFoundException(String location) {
    super("Requested cassette not found: " + location);
    this.location = location;
  }

  /** @return location that was looked up */
  public String location() {
    return location;
  }
}
