package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.domain.diagnostics.DiagnosticKind;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import java.util.List;

/**
 * Deletes attributes after every other stage has run. {@code sample_name} is never removed.
 *
 * @since 0.1.0
 */
final class RemoveStage implements ModifierStage {
  private final List<String> remove;

  RemoveStage(List<String> remove) {
    this.remove = List.copyOf(remove);
  }

  @Override
  public String name() {
    return "remove";
  }

  @Override
  public void apply(SampleDraft sample, ResolutionContext context) {
    for (String attribute : remove) {
      if (SampleRecord.SAMPLE_NAME.equals(attribute)) {
        context.diagnostics().record(DiagnosticKind.PROTECTED_ATTRIBUTE, sample.sampleName(), attribute,
            "'" + attribute + "' identifies the sample and cannot be removed");
        continue;
      }
      sample.remove(attribute);
    }
  }
}
