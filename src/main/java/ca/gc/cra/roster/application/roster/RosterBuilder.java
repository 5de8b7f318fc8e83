package ca.gc.cra.roster.application.roster;

import ca.gc.cra.roster.application.merge.SubsampleMerger;
import ca.gc.cra.roster.application.modifier.ModifierPipeline;
import ca.gc.cra.roster.application.modifier.ResolutionContext;
import ca.gc.cra.roster.application.port.EnvironmentPort;
import ca.gc.cra.roster.application.port.MetricsPort;
import ca.gc.cra.roster.application.port.TableSource;
import ca.gc.cra.roster.application.port.TableSource.RawTable;
import ca.gc.cra.roster.application.port.WildcardResolver;
import ca.gc.cra.roster.application.substitution.VariableExpander;
import ca.gc.cra.roster.config.MetadataSettings;
import ca.gc.cra.roster.config.ProjectConfig;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticsCollector;
import ca.gc.cra.roster.domain.error.DuplicateSampleNameException;
import ca.gc.cra.roster.domain.error.SampleTableException;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import ca.gc.cra.roster.domain.sample.SubsampleRow;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a {@link ProjectConfig} into a {@link SampleRoster}.
 * <p><strong>Why:</strong> Keeps the resolution order in one place: annotation rows, subsample merge, then the
 * modifier pipeline, then freezing.</p>
 * <p><strong>Role:</strong> Application service behind {@link ProjectResolver}.</p>
 * <p><strong>Thread-safety:</strong> Holds only immutable collaborators; each {@link #build(ProjectConfig)} call
 * keeps its state on the stack, so concurrent builds are independent.</p>
 * <p><strong>Observability:</strong> Emits {@code roster.build.count}, {@code roster.build.failed},
 * {@code roster.build.latencyNanos}, {@code roster.samples.size} and {@code roster.diagnostics.<kind>}.</p>
 *
 * @since 0.1.0
 */
public final class RosterBuilder {
  private static final Logger log = LoggerFactory.getLogger(RosterBuilder.class);

  private final TableSource tables;
  private final VariableExpander expander;
  private final EnvironmentPort environment;
  private final MetricsPort metrics;
  private final SubsampleMerger merger = new SubsampleMerger();

  /**
   * Creates a builder.
   *
   * @param tables reader for annotation and subannotation tables
   * @param wildcards filesystem globbing used by derived attributes
   * @param environment environment scope for placeholders
   * @param metrics metrics sink
   */
  public RosterBuilder(TableSource tables, WildcardResolver wildcards, EnvironmentPort environment,
      MetricsPort metrics) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.expander = new VariableExpander(Objects.requireNonNull(wildcards, "wildcards"));
    this.environment = Objects.requireNonNull(environment, "environment");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Resolves every sample of {@code config}.
   *
   * @param config configuration, with its amendment (if any) already applied
   * @return resolved roster
   * @throws SampleTableException when a table is unreadable or a row has no sample name
   * @throws DuplicateSampleNameException when two samples share a name
   */
  public SampleRoster build(ProjectConfig config) {
    Objects.requireNonNull(config, "config");
    metrics.increment("roster.build.count");
    long started = System.nanoTime();
    try {
      SampleRoster roster = doBuild(config);
      metrics.observe("roster.samples.size", roster.size());
      log.info("Resolved {} samples for project '{}'{} with {} diagnostics", roster.size(), config.name(),
          config.activeAmendment().map(a -> " (amendment " + a + ")").orElse(""), roster.diagnostics().size());
      return roster;
    } catch (RuntimeException ex) {
      metrics.increment("roster.build.failed");
      log.error("Failed to resolve project '{}' from {}: {}", config.name(), config.configFile(), ex.getMessage());
      throw ex;
    } finally {
      metrics.observe("roster.build.latencyNanos", System.nanoTime() - started);
    }
  }

  private SampleRoster doBuild(ProjectConfig config) {
    MetadataSettings metadata = config.metadata();
    String indexColumn = metadata.sampleTableIndex();
    DiagnosticsCollector diagnostics = new DiagnosticsCollector();

    RawTable annotation = tables.read(metadata.sampleAnnotation());
    if (!annotation.hasColumn(SampleRecord.SAMPLE_NAME) && !annotation.hasColumn(indexColumn)) {
      throw new SampleTableException(SampleRecord.SAMPLE_NAME.equals(indexColumn)
          ? "Sample table " + annotation.source() + " has no '" + SampleRecord.SAMPLE_NAME + "' column"
          : "Sample table " + annotation.source() + " has neither '" + SampleRecord.SAMPLE_NAME + "' nor '"
              + indexColumn + "' column");
    }

    List<SampleDraft> drafts = seed(annotation, indexColumn);
    requireUniqueNames(drafts);

    Map<String, SampleDraft> byName = new LinkedHashMap<>();
    drafts.forEach(draft -> byName.put(draft.sampleName(), draft));
    // each table merges on its own; a later table's columns replace what an earlier one merged
    for (Path table : metadata.sampleSubannotations()) {
      RawTable subannotation = tables.read(table);
      List<SubsampleRow> rows = merger.rows(subannotation, indexColumn);
      merger.mergeAll(byName, rows, indexColumn, diagnostics);
    }

    ModifierPipeline pipeline = ModifierPipeline.from(config.sampleModifiers(), expander);
    ResolutionContext context = new ResolutionContext(config.projectScope(), environment.snapshot(), diagnostics);
    for (SampleDraft draft : drafts) {
      pipeline.apply(draft, context);
    }
    requireUniqueNames(drafts);

    List<SampleRecord> samples = new ArrayList<>(drafts.size());
    for (SampleDraft draft : drafts) {
      samples.add(draft.freeze());
    }
    diagnostics.countsByKind().forEach((kind, count) -> {
      for (int i = 0; i < count; i++) {
        metrics.increment("roster.diagnostics." + kind.metricName());
      }
    });
    return new SampleRoster(config, samples, diagnostics.diagnostics());
  }

  private static List<SampleDraft> seed(RawTable annotation, String indexColumn) {
    List<SampleDraft> drafts = new ArrayList<>(annotation.rows().size());
    for (int i = 0; i < annotation.rows().size(); i++) {
      SampleDraft draft = SampleDraft.fromRow(annotation.rows().get(i));
      if (!draft.has(SampleRecord.SAMPLE_NAME) && draft.has(indexColumn)) {
        draft.set(SampleRecord.SAMPLE_NAME, draft.values(indexColumn));
      }
      if (draft.sampleName() == null || draft.sampleName().isBlank()) {
        throw new SampleTableException("Sample table " + annotation.source() + " row " + (i + 1)
            + " has no sample name");
      }
      drafts.add(draft);
    }
    return drafts;
  }

  private static void requireUniqueNames(List<SampleDraft> drafts) {
    Set<String> seen = new LinkedHashSet<>();
    Set<String> duplicates = new LinkedHashSet<>();
    for (SampleDraft draft : drafts) {
      String name = draft.sampleName();
      if (name != null && !seen.add(name)) {
        duplicates.add(name);
      }
    }
    if (!duplicates.isEmpty()) {
      throw new DuplicateSampleNameException(List.copyOf(duplicates));
    }
  }
}
