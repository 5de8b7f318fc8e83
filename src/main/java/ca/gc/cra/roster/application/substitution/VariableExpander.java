package ca.gc.cra.roster.application.substitution;

import ca.gc.cra.roster.application.port.WildcardResolver;
import ca.gc.cra.roster.domain.error.UnresolvedVariableException;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Expands {@code {name}} placeholders in path templates and globs a wildcard in the
 * trailing path segment.
 * <p><strong>Why:</strong> Derived attributes and templated metadata paths share one substitution rule set.</p>
 * <p><strong>Role:</strong> Domain service used by the derive stage and the config loader.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected {@link WildcardResolver}; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class VariableExpander {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_.-]*)}");

  private final WildcardResolver wildcards;

  /**
   * Creates an expander.
   *
   * @param wildcards filesystem globbing port
   */
  public VariableExpander(WildcardResolver wildcards) {
    this.wildcards = Objects.requireNonNull(wildcards, "wildcards");
  }

  /**
   * Replaces every placeholder in {@code template}; no globbing.
   *
   * @param template template text
   * @param scope namespace to resolve against
   * @return substituted text
   * @throws UnresolvedVariableException when a placeholder is defined by no tier
   */
  public static String substitute(String template, ExpansionScope scope) {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(scope, "scope");
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder(template.length());
    while (matcher.find()) {
      String name = matcher.group(1);
      String value = scope.lookup(name)
          .orElseThrow(() -> new UnresolvedVariableException(name, template));
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /**
   * Reports whether {@code text} contains at least one placeholder.
   *
   * @param text candidate text
   * @return {@code true} when substitution would change anything
   */
  public static boolean hasPlaceholders(String text) {
    return text != null && PLACEHOLDER.matcher(text).find();
  }

  /**
   * Substitutes placeholders, then expands a trailing-segment wildcard.
   *
   * @param template template text
   * @param scope namespace to resolve against
   * @return the substituted value as a single token, or the sorted matches when the value is a wildcard
   *     pattern (empty when nothing matches)
   * @throws UnresolvedVariableException when a placeholder is defined by no tier
   * @throws IOException when a wildcard parent directory cannot be listed
   */
  public List<String> expandTokens(String template, ExpansionScope scope) throws IOException {
    String substituted = substitute(template, scope);
    if (!WildcardResolver.hasTrailingWildcard(substituted)) {
      return List.of(substituted);
    }
    return List.copyOf(wildcards.expand(substituted));
  }

  /**
   * Joined form of {@link #expandTokens(String, ExpansionScope)}.
   *
   * @param template template text
   * @param scope namespace to resolve against
   * @return space-joined expansion; empty string for an unmatched wildcard
   * @throws IOException when a wildcard parent directory cannot be listed
   */
  public String expand(String template, ExpansionScope scope) throws IOException {
    return SampleRecord.join(expandTokens(template, scope));
  }

  /**
   * Convenience overload taking the three tiers separately.
   *
   * @param template template text
   * @param sample sample attributes
   * @param project project scalars
   * @param environment environment variables
   * @return space-joined expansion
   * @throws IOException when a wildcard parent directory cannot be listed
   */
  public String expand(String template, Map<String, String> sample, Map<String, String> project,
      Map<String, String> environment) throws IOException {
    return expand(template, new ExpansionScope(sample, project, environment));
  }
}
