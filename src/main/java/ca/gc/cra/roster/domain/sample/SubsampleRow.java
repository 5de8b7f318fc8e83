package ca.gc.cra.roster.domain.sample;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of a subsample table, keyed by sample name and subsample name.
 *
 * @param sampleName sample the row belongs to; never {@code null}
 * @param subsampleName declared {@code subsample_name}, or the row's data index when the table has none
 * @param rowIndex 0-based data-row index within the subsample table
 * @param values non-empty cells of the row in column order, identifier columns included
 *
 * @since 0.1.0
 */
public record SubsampleRow(String sampleName, String subsampleName, int rowIndex, Map<String, String> values) {
  /** Column naming a subsample within its sample. */
  public static final String SUBSAMPLE_NAME = "subsample_name";

  public SubsampleRow {
    sampleName = Objects.requireNonNull(sampleName, "sampleName");
    subsampleName = Objects.requireNonNull(subsampleName, "subsampleName");
    values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Returns the non-empty value of a column in this row.
   *
   * @param column column name
   * @return value when the row carries a non-empty cell for {@code column}
   */
  public Optional<String> value(String column) {
    return Optional.ofNullable(values.get(column));
  }
}
