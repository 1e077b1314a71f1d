package ca.gc.cra.vcr.application.recorder;

import ca.gc.cra.vcr.domain.cassette.Interaction;

/**
 * Caller code that inspects or transforms one interaction at a {@link HookStage}.
 *
 * <p>Hooks of a stage run sequentially in registration order; the first failure aborts the stage and the operation
 * that triggered it. Hooks must not retain the interaction after returning.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface InteractionHook {
  /**
   * Applies the hook.
   *
   * @param interaction interaction to inspect or mutate
   * @throws Exception to abort the stage; surfaced to the caller of the triggering operation
   */
  void apply(Interaction interaction) throws Exception;
}
