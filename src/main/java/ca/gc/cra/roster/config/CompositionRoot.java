package ca.gc.cra.roster.config;

import ca.gc.cra.roster.application.port.EnvironmentPort;
import ca.gc.cra.roster.application.port.MetricsPort;
import ca.gc.cra.roster.application.port.TableSource;
import ca.gc.cra.roster.application.port.WildcardResolver;
import ca.gc.cra.roster.application.roster.ProjectResolver;
import ca.gc.cra.roster.application.roster.RosterBuilder;
import ca.gc.cra.roster.infrastructure.env.SystemEnvironmentAdapter;
import ca.gc.cra.roster.infrastructure.fs.GlobWildcardResolver;
import ca.gc.cra.roster.infrastructure.table.DelimitedTableReader;
import ca.gc.cra.roster.infrastructure.table.DelimitedTableWriter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the roster use cases to their default adapters.
 * <p><strong>Why:</strong> CLIs and embedding callers get a ready {@link ProjectResolver} without knowing which
 * adapters implement the ports.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable adapters; the resolver it returns is safe to share.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final EnvironmentPort environment;
  private final TableSource tables;
  private final WildcardResolver wildcards;
  private final MetricsPort metrics;

  /**
   * Creates a root using the process environment, opencsv tables and filesystem globbing.
   *
   * @param metrics metrics sink for roster builds
   */
  public CompositionRoot(MetricsPort metrics) {
    this(new SystemEnvironmentAdapter(), new DelimitedTableReader(), new GlobWildcardResolver(), metrics);
  }

  /**
   * Creates a root with explicit adapters.
   *
   * @param environment environment scope
   * @param tables table reader
   * @param wildcards wildcard resolver
   * @param metrics metrics sink
   */
  public CompositionRoot(EnvironmentPort environment, TableSource tables, WildcardResolver wildcards,
      MetricsPort metrics) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.wildcards = Objects.requireNonNull(wildcards, "wildcards");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public ProjectConfigLoader configLoader() {
    return new ProjectConfigLoader(environment);
  }

  public RosterBuilder rosterBuilder() {
    return new RosterBuilder(tables, wildcards, environment, metrics);
  }

  public ProjectResolver projectResolver() {
    return new ProjectResolver(configLoader(), rosterBuilder());
  }

  public DelimitedTableWriter tableWriter() {
    return new DelimitedTableWriter();
  }

  public MetricsPort metrics() {
    return metrics;
  }
}
