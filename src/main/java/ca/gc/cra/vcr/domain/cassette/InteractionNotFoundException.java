package ca.gc.cra.vcr.domain.cassette;

import java.io.IOException;

/**
 * Signals that no recorded interaction is available for a request.
 *
 * @since 0.1.0
 */
public final class InteractionNotFoundException extends IOException {
  private static final long serialVersionUID = 1L;

  public InteractionNotFoundException(String message) {
    super(message);
  }
}
