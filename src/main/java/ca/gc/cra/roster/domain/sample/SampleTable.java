package ca.gc.cra.roster.domain.sample;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tabular export of a resolved roster.
 *
 * @param columns ordered column names; the union of attribute names in first-seen order
 * @param rows one row per sample in roster order; missing attributes are empty strings
 *
 * @since 0.1.0
 */
public record SampleTable(List<String> columns, List<List<String>> rows) {

  public SampleTable {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    List<List<String>> copy = new ArrayList<>();
    for (List<String> row : Objects.requireNonNull(rows, "rows")) {
      if (row.size() != columns.size()) {
        throw new IllegalArgumentException("row width " + row.size() + " != column count " + columns.size());
      }
      copy.add(List.copyOf(row));
    }
    rows = List.copyOf(copy);
  }

  /**
   * Builds a table from resolved samples.
   *
   * @param samples samples in roster order
   * @return table with joined values
   */
  public static SampleTable from(List<SampleRecord> samples) {
    Set<String> columns = new LinkedHashSet<>();
    columns.add(SampleRecord.SAMPLE_NAME);
    for (SampleRecord sample : samples) {
      columns.addAll(sample.attributeNames());
    }
    List<String> header = List.copyOf(columns);
    List<List<String>> rows = new ArrayList<>(samples.size());
    for (SampleRecord sample : samples) {
      List<String> row = new ArrayList<>(header.size());
      for (String column : header) {
        row.add(sample.get(column).orElse(""));
      }
      rows.add(row);
    }
    return new SampleTable(header, rows);
  }
}
