package ca.gc.cra.vcr.application.recorder;

import java.io.IOException;

/**
 * Wraps a checked, non-I/O exception thrown by an {@link InteractionHook}.
 *
 * @since 0.1.0
 */
public final class HookException extends IOException {
  private static final long serialVersionUID = 1L;

  private final HookStage stage;

  public HookException(HookStage stage, Throwable cause) {
    super("Hook failed at " + stage + ": " + cause.getMessage(), cause);
    this.stage = stage;
  }

  /** @return stage whose hook failed */
  public HookStage stage() {
    return stage;
  }
}
