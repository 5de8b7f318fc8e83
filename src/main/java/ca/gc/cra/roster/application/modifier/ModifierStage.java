package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.domain.sample.SampleDraft;

/**
 * One step of the attribute modifier pipeline.
 *
 * @since 0.1.0
 */
public interface ModifierStage {
  /**
   * Returns the {@code sample_modifiers} key this stage implements.
   *
   * @return stage name (e.g., {@code derive})
   */
  String name();

  /**
   * Applies the stage to one sample in place.
   *
   * @param sample sample under resolution
   * @param context shared scopes and diagnostics of the current resolution
   */
  void apply(SampleDraft sample, ResolutionContext context);
}
