package ca.gc.cra.vcr.application.recorder;

/**
 * Lifecycle points at which {@link InteractionHook}s run.
 *
 * @since 0.1.0
 */
public enum HookStage {
  /** After a real exchange was captured and before it is added to the cassette. */
  AFTER_CAPTURE,
  /** During stop, over every interaction held in memory, before the cassette is saved. */
  BEFORE_SAVE,
  /** Over the matched copy before a replayed response is returned. */
  BEFORE_RESPONSE_REPLAY,
  /** During stop, after the save, over every remaining interaction. */
  ON_RECORDER_STOP
}
