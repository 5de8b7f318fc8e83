package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.domain.diagnostics.DiagnosticKind;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies attribute values under new names. When the target already exists the copy goes to the first
 * free {@code <target>_N}.
 *
 * @since 0.1.0
 */
final class DuplicateStage implements ModifierStage {
  private final Map<String, String> duplicate;

  DuplicateStage(Map<String, String> duplicate) {
    this.duplicate = new LinkedHashMap<>(duplicate);
  }

  @Override
  public String name() {
    return "duplicate";
  }

  @Override
  public void apply(SampleDraft sample, ResolutionContext context) {
    duplicate.forEach((source, target) -> {
      if (!sample.has(source)) {
        context.diagnostics().record(DiagnosticKind.MISSING_DUPLICATE_SOURCE, sample.sampleName(), source,
            "cannot duplicate missing attribute '" + source + "' to '" + target + "'");
        return;
      }
      String destination = target;
      if (sample.has(target)) {
        destination = freeName(sample, target);
        context.diagnostics().record(DiagnosticKind.DUPLICATE_TARGET_RENAMED, sample.sampleName(), target,
            "attribute '" + target + "' already exists; copy of '" + source + "' stored as '" + destination + "'");
      }
      sample.set(destination, sample.values(source));
    });
  }

  private static String freeName(SampleDraft sample, String target) {
    int suffix = 1;
    while (sample.has(target + "_" + suffix)) {
      suffix++;
    }
    return target + "_" + suffix;
  }
}
