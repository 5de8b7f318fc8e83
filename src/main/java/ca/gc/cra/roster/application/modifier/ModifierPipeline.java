package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.application.substitution.VariableExpander;
import ca.gc.cra.roster.config.SampleModifiers;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Applies the {@code sample_modifiers} stages to a sample in their fixed order: append,
 * duplicate, derive, imply, remove.
 * <p><strong>Why:</strong> A fixed order makes two resolutions of the same project produce identical samples
 * regardless of how the YAML lists the sections.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the mutable state lives in the draft and the context.</p>
 *
 * @since 0.1.0
 */
public final class ModifierPipeline {
  private final List<ModifierStage> stages;

  ModifierPipeline(List<ModifierStage> stages) {
    this.stages = List.copyOf(stages);
  }

  /**
   * Builds the pipeline for a configuration's modifiers.
   *
   * @param modifiers parsed {@code sample_modifiers}
   * @param expander expander used by the derive stage
   * @return pipeline with all five stages
   */
  public static ModifierPipeline from(SampleModifiers modifiers, VariableExpander expander) {
    Objects.requireNonNull(modifiers, "modifiers");
    return new ModifierPipeline(List.of(
        new AppendStage(modifiers.append()),
        new DuplicateStage(modifiers.duplicate()),
        new DeriveStage(modifiers.derive(), expander),
        new ImplyStage(modifiers.imply()),
        new RemoveStage(modifiers.remove())));
  }

  /**
   * Runs every stage on {@code sample}.
   *
   * @param sample sample under resolution; modified in place
   * @param context resolution state
   */
  public void apply(SampleDraft sample, ResolutionContext context) {
    for (ModifierStage stage : stages) {
      stage.apply(sample, context);
    }
  }

  public List<String> stageNames() {
    return stages.stream().map(ModifierStage::name).toList();
  }
}
