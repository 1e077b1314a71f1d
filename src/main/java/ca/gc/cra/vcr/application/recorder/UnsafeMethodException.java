package ca.gc.cra.vcr.application.recorder;

import java.io.IOException;

/**
 * Signals a request blocked because its method may change state on a real server.
 *
 * @since 0.1.0
 */
public final class UnsafeMethodException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String method;

  public UnsafeMethodException(String method, String target) {
    super("Unsafe request method " + method + " blocked for " + target);
    this.method = method;
  }

  /** @return the blocked HTTP verb */
  public String method() {
    return method;
  }
}
