package ca.gc.cra.vcr.application.recorder;

/**
 * Signals an unknown or missing recorder mode. Raised at construction, before any request is handled.
 *
 * @since 0.1.0
 */
public final class InvalidModeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidModeException(String message) {
    super(message);
  }
}
