package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.config.ImpliedAttributeSpec;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates implication rules in declaration order; a later matching rule overwrites what an earlier one set.
 *
 * @since 0.1.0
 */
final class ImplyStage implements ModifierStage {
  private static final Logger log = LoggerFactory.getLogger(ImplyStage.class);

  private final List<ImpliedAttributeSpec> rules;

  ImplyStage(List<ImpliedAttributeSpec> rules) {
    this.rules = List.copyOf(rules);
  }

  @Override
  public String name() {
    return "imply";
  }

  @Override
  public void apply(SampleDraft sample, ResolutionContext context) {
    for (ImpliedAttributeSpec rule : rules) {
      if (rule.matches(sample)) {
        rule.assignments().forEach(sample::set);
        log.debug("Sample '{}' matched implication {}; set {}", sample.sampleName(), rule.conditions(),
            rule.assignments().keySet());
      }
    }
  }
}
