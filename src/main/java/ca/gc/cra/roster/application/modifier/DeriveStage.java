package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.application.port.WildcardResolver;
import ca.gc.cra.roster.application.substitution.ExpansionScope;
import ca.gc.cra.roster.application.substitution.VariableExpander;
import ca.gc.cra.roster.config.DerivedAttributeSpec;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticKind;
import ca.gc.cra.roster.domain.error.UnresolvedVariableException;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import ca.gc.cra.roster.domain.sample.SubsampleRow;
import ca.gc.cra.roster.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Replaces attribute tokens that name a data source with the source's expanded template.
 * <p><strong>Why:</strong> Annotation tables carry short source keys; collaborators need concrete file paths.</p>
 * <p><strong>Role:</strong> Third pipeline stage, after append and duplicate and before imply.</p>
 *
 * <p>Tokens are expanded one at a time and rejoined in order; tokens that name no source pass through. A
 * token contributed by a subsample row is expanded with that row's cells as the highest-priority scope and
 * is never globbed. If any token fails (undefined variable, unreadable directory) the attribute keeps its
 * whole pre-derive value. A successful derivation keeps the pre-derive tokens under
 * {@code _key_<attribute>}.</p>
 *
 * @since 0.1.0
 */
final class DeriveStage implements ModifierStage {
  private static final Logger log = LoggerFactory.getLogger(DeriveStage.class);
  private static final int MAX_LOGGED_TOKENS = 8;

  private final List<DerivedAttributeSpec> specs;
  private final VariableExpander expander;

  DeriveStage(List<DerivedAttributeSpec> specs, VariableExpander expander) {
    this.specs = List.copyOf(specs);
    this.expander = Objects.requireNonNull(expander, "expander");
  }

  @Override
  public String name() {
    return "derive";
  }

  @Override
  public void apply(SampleDraft sample, ResolutionContext context) {
    for (DerivedAttributeSpec spec : specs) {
      if (sample.has(spec.attribute())) {
        derive(sample, spec, context);
      }
    }
  }

  private void derive(SampleDraft sample, DerivedAttributeSpec spec, ResolutionContext context) {
    String attribute = spec.attribute();
    List<String> original = sample.values(attribute);
    List<SubsampleRow> contributors = contributors(sample, attribute, original.size());
    ExpansionScope scope = context.scopeFor(sample);
    List<String> derived = new ArrayList<>();

    for (int i = 0; i < original.size(); i++) {
      String token = original.get(i);
      Optional<String> template = spec.templateFor(token);
      if (template.isEmpty()) {
        log.debug("Sample '{}' attribute '{}' token '{}' names no data source; kept", sample.sampleName(),
            attribute, token);
        derived.add(token);
        continue;
      }
      try {
        if (contributors != null) {
          derived.add(expandSubsampleToken(sample, attribute, template.get(), scope, contributors.get(i), context));
        } else {
          List<String> matches = expander.expandTokens(template.get(), scope);
          if (matches.isEmpty()) {
            context.diagnostics().record(DiagnosticKind.UNMATCHED_WILDCARD, sample.sampleName(), attribute,
                "no files match '" + VariableExpander.substitute(template.get(), scope) + "'");
          }
          derived.addAll(matches);
        }
      } catch (UnresolvedVariableException ex) {
        context.diagnostics().record(DiagnosticKind.UNRESOLVED_VARIABLE, sample.sampleName(), attribute,
            ex.getMessage() + "; kept '" + Logs.summarize(original, MAX_LOGGED_TOKENS) + "'");
        return;
      } catch (IOException ex) {
        context.diagnostics().record(DiagnosticKind.WILDCARD_FAILURE, sample.sampleName(), attribute,
            "unable to expand '" + template.get() + "': " + ex.getMessage());
        return;
      }
    }
    sample.set(SampleRecord.SOURCE_KEY_PREFIX + attribute, original);
    sample.set(attribute, derived);
    if (log.isDebugEnabled()) {
      log.debug("Sample '{}' derived '{}' = {}", sample.sampleName(), attribute,
          Logs.summarize(derived, MAX_LOGGED_TOKENS));
    }
  }

  private static String expandSubsampleToken(SampleDraft sample, String attribute, String template,
      ExpansionScope scope, SubsampleRow row, ResolutionContext context) {
    String value = VariableExpander.substitute(template, scope.withPriority(row.values()));
    if (WildcardResolver.hasTrailingWildcard(value)) {
      context.diagnostics().record(DiagnosticKind.SUBSAMPLE_WILDCARD_CONFLICT, sample.sampleName(), attribute,
          "subsample '" + row.subsampleName() + "' value '" + value
              + "' contains a wildcard; subsample values are used verbatim");
    }
    return value;
  }

  /**
   * Returns the subsample rows that contributed each token of a merged attribute, or {@code null} when the
   * attribute was not merged or the tokens no longer line up with the rows.
   */
  private static List<SubsampleRow> contributors(SampleDraft sample, String attribute, int tokenCount) {
    if (!sample.isMerged(attribute)) {
      return null;
    }
    List<SubsampleRow> rows = new ArrayList<>();
    for (SubsampleRow row : sample.subsamples()) {
      if (row.value(attribute).isPresent()) {
        rows.add(row);
      }
    }
    return rows.size() == tokenCount ? rows : null;
  }
}
