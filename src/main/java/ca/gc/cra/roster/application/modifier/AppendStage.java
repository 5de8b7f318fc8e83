package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.domain.sample.SampleDraft;
import java.util.List;
import java.util.Map;

/**
 * Adds constant attributes to samples that lack them; existing values are never overwritten.
 *
 * @since 0.1.0
 */
final class AppendStage implements ModifierStage {
  private final Map<String, List<String>> append;

  AppendStage(Map<String, List<String>> append) {
    this.append = Map.copyOf(append);
  }

  @Override
  public String name() {
    return "append";
  }

  @Override
  public void apply(SampleDraft sample, ResolutionContext context) {
    append.forEach((attribute, tokens) -> {
      if (!sample.has(attribute)) {
        sample.set(attribute, tokens);
      }
    });
  }
}
