package ca.gc.cra.roster.domain.diagnostics;

import ca.gc.cra.roster.logging.Logs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the diagnostics of one roster resolution and mirrors each as an SLF4J warning.
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per resolution.</p>
 *
 * @since 0.1.0
 */
public final class DiagnosticsCollector {
  private static final Logger log = LoggerFactory.getLogger(DiagnosticsCollector.class);
  private static final int MAX_LOGGED_BYTES = 512;

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  /**
   * Records a diagnostic.
   *
   * @param kind condition category
   * @param sampleName affected sample, or {@code null}
   * @param attribute affected attribute, or {@code null}
   * @param message detail
   */
  public void record(DiagnosticKind kind, String sampleName, String attribute, String message) {
    Diagnostic diagnostic = new Diagnostic(kind, sampleName, attribute, message);
    diagnostics.add(diagnostic);
    if (log.isWarnEnabled()) {
      log.warn("{}", Logs.truncate(diagnostic.toString(), MAX_LOGGED_BYTES));
    }
  }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  /**
   * Counts recorded diagnostics per kind.
   *
   * @return kind to count; kinds never recorded are absent
   */
  public Map<DiagnosticKind, Integer> countsByKind() {
    Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
    for (Diagnostic diagnostic : diagnostics) {
      counts.merge(Objects.requireNonNull(diagnostic.kind()), 1, Integer::sum);
    }
    return counts;
  }
}
