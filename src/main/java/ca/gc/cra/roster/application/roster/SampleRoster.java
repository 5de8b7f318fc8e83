package ca.gc.cra.roster.application.roster;

import ca.gc.cra.roster.config.ProjectConfig;
import ca.gc.cra.roster.domain.diagnostics.Diagnostic;
import ca.gc.cra.roster.domain.error.SampleNotFoundException;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import ca.gc.cra.roster.domain.sample.SampleTable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Ordered, immutable collection of resolved samples for one project configuration.
 * <p><strong>Why:</strong> Gives collaborators a single query surface (lookup, iteration, selection, export)
 * independent of how the samples were resolved.</p>
 * <p><strong>Role:</strong> Output of {@link RosterBuilder}; replaced wholesale when an amendment is activated.</p>
 * <p><strong>Thread-safety:</strong> Immutable; iteration is restartable and safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class SampleRoster implements Iterable<SampleRecord> {
  private final ProjectConfig config;
  private final List<SampleRecord> samples;
  private final Map<String, SampleRecord> byName;
  private final List<Diagnostic> diagnostics;

  /**
   * Creates a roster.
   *
   * @param config configuration the samples were resolved from
   * @param samples samples in annotation order; names must be unique
   * @param diagnostics conditions recorded during resolution
   * @throws IllegalArgumentException when two samples share a name
   */
  public SampleRoster(ProjectConfig config, List<SampleRecord> samples, List<Diagnostic> diagnostics) {
    this.config = Objects.requireNonNull(config, "config");
    this.samples = List.copyOf(samples);
    this.diagnostics = List.copyOf(diagnostics);
    Map<String, SampleRecord> index = new LinkedHashMap<>();
    for (SampleRecord sample : this.samples) {
      if (index.put(sample.sampleName(), sample) != null) {
        throw new IllegalArgumentException("duplicate sample name " + sample.sampleName());
      }
    }
    this.byName = index;
  }

  /**
   * Looks up a sample by name.
   *
   * @param name sample name
   * @return the sample
   * @throws SampleNotFoundException when no sample has that name
   */
  public SampleRecord sample(String name) {
    SampleRecord sample = byName.get(name);
    if (sample == null) {
      throw new SampleNotFoundException(name);
    }
    return sample;
  }

  public List<SampleRecord> samples() {
    return samples;
  }

  @Override
  public Iterator<SampleRecord> iterator() {
    return samples.iterator();
  }

  public Stream<SampleRecord> stream() {
    return samples.stream();
  }

  public int size() {
    return samples.size();
  }

  public List<String> amendmentNames() {
    return config.amendmentNames();
  }

  public Optional<String> activeAmendment() {
    return config.activeAmendment();
  }

  public ProjectConfig config() {
    return config;
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  /**
   * Exports the roster as a table of joined values.
   *
   * @return table with one row per sample in roster order
   */
  public SampleTable toTable() {
    return SampleTable.from(samples);
  }

  /**
   * Selects samples by the joined value of one attribute.
   *
   * <p>With {@code include}, only samples whose value is listed are kept; samples lacking the attribute are
   * dropped. With {@code exclude}, samples whose value is listed are dropped; samples lacking the attribute are
   * kept. With neither, every sample is returned.</p>
   *
   * @param attribute attribute to test
   * @param include accepted values, or {@code null}/empty
   * @param exclude rejected values, or {@code null}/empty
   * @return matching samples in roster order
   * @throws IllegalArgumentException when both filters are given or no sample has {@code attribute}
   */
  public List<SampleRecord> select(String attribute, Collection<String> include, Collection<String> exclude) {
    Objects.requireNonNull(attribute, "attribute");
    boolean including = include != null && !include.isEmpty();
    boolean excluding = exclude != null && !exclude.isEmpty();
    if (including && excluding) {
      throw new IllegalArgumentException("include and exclude are mutually exclusive");
    }
    if (samples.stream().noneMatch(sample -> sample.has(attribute))) {
      throw new IllegalArgumentException("No sample has attribute '" + attribute + "'");
    }
    List<SampleRecord> selected = new ArrayList<>();
    for (SampleRecord sample : samples) {
      Optional<String> value = sample.get(attribute);
      if (including) {
        if (value.isPresent() && include.contains(value.get())) {
          selected.add(sample);
        }
      } else if (excluding) {
        if (value.isEmpty() || !exclude.contains(value.get())) {
          selected.add(sample);
        }
      } else {
        selected.add(sample);
      }
    }
    return selected;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SampleRoster other)) {
      return false;
    }
    return config.equals(other.config) && samples.equals(other.samples) && diagnostics.equals(other.diagnostics);
  }

  @Override
  public int hashCode() {
    return Objects.hash(config, samples, diagnostics);
  }

  @Override
  public String toString() {
    return "SampleRoster[project=" + config.name() + ", samples=" + samples.size()
        + activeAmendment().map(a -> ", amendment=" + a).orElse("") + "]";
  }
}
