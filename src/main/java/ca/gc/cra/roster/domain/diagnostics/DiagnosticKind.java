package ca.gc.cra.roster.domain.diagnostics;

import java.util.Locale;

/**
 * Categories of degraded, non-fatal conditions observed while resolving a roster.
 *
 * @since 0.1.0
 */
public enum DiagnosticKind {
  /** A derive template referenced a variable no scope provides; the pre-derive value was kept. */
  UNRESOLVED_VARIABLE,
  /** A trailing wildcard matched no files; the attribute resolved to an empty value. */
  UNMATCHED_WILDCARD,
  /** Listing files for a wildcard failed; the pre-derive value was kept. */
  WILDCARD_FAILURE,
  /** A subsample-contributed token still contains a wildcard after substitution. */
  SUBSAMPLE_WILDCARD_CONFLICT,
  /** A {@code duplicate} modifier named a source attribute the sample lacks. */
  MISSING_DUPLICATE_SOURCE,
  /** A {@code duplicate} target already existed; the clone was stored under a suffixed name. */
  DUPLICATE_TARGET_RENAMED,
  /** A modifier tried to remove an attribute that identifies the sample. */
  PROTECTED_ATTRIBUTE,
  /** A subsample row names a sample that the annotation table does not contain. */
  ORPHAN_SUBSAMPLE_ROW;

  /**
   * Returns the metric-friendly name of this kind.
   *
   * @return lower-case, dot-free identifier (e.g., {@code unresolved_variable})
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
