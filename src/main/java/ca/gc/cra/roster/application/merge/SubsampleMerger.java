package ca.gc.cra.roster.application.merge;

import ca.gc.cra.roster.application.port.TableSource.RawTable;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticKind;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticsCollector;
import ca.gc.cra.roster.domain.error.SampleTableException;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import ca.gc.cra.roster.domain.sample.SubsampleRow;
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
 * <strong>What:</strong> Folds subsample table rows into multi-valued sample attributes.
 * <p><strong>Why:</strong> A sample sequenced over several runs lists one file per subsample row; downstream
 * consumers want a single attribute holding every file.</p>
 * <p><strong>Role:</strong> Runs after annotation rows are seeded and before the modifier pipeline.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * <p>For every non-identifier column, the non-empty values of a sample's rows are concatenated in file order
 * and replace the annotation value. A column that is empty in all of a sample's rows leaves the annotation
 * value alone.</p>
 *
 * @since 0.1.0
 */
public final class SubsampleMerger {
  private static final Logger log = LoggerFactory.getLogger(SubsampleMerger.class);

  /**
   * Converts a subsample table into rows.
   *
   * @param table subsample table
   * @param indexColumn column naming samples when the table has no {@code sample_name} column
   * @return rows in file order
   * @throws SampleTableException when the table has no sample column or a row names no sample
   */
  public List<SubsampleRow> rows(RawTable table, String indexColumn) {
    Objects.requireNonNull(table, "table");
    String sampleColumn = table.hasColumn(SampleRecord.SAMPLE_NAME) ? SampleRecord.SAMPLE_NAME : indexColumn;
    if (!table.hasColumn(sampleColumn)) {
      throw new SampleTableException("Subsample table " + table.source() + " has no '"
          + SampleRecord.SAMPLE_NAME + "' column");
    }
    List<SubsampleRow> rows = new ArrayList<>(table.rows().size());
    for (int i = 0; i < table.rows().size(); i++) {
      Map<String, String> values = new LinkedHashMap<>();
      table.rows().get(i).forEach((column, value) -> {
        if (value != null && !value.isEmpty()) {
          values.put(column, value);
        }
      });
      String sampleName = values.get(sampleColumn);
      if (sampleName == null) {
        throw new SampleTableException("Subsample table " + table.source() + " row " + (i + 1)
            + " has no value for '" + sampleColumn + "'");
      }
      String subsampleName = values.getOrDefault(SubsampleRow.SUBSAMPLE_NAME, String.valueOf(i));
      rows.add(new SubsampleRow(sampleName, subsampleName, i, values));
    }
    return rows;
  }

  /**
   * Merges rows into the drafts they name; rows naming unknown samples are reported and skipped.
   *
   * @param drafts sample name to draft, in annotation order
   * @param rows subsample rows in file order
   * @param indexColumn column naming samples, excluded from merging
   * @param diagnostics sink for orphan rows
   */
  public void mergeAll(Map<String, SampleDraft> drafts, List<SubsampleRow> rows, String indexColumn,
      DiagnosticsCollector diagnostics) {
    Map<String, List<SubsampleRow>> grouped = new LinkedHashMap<>();
    for (SubsampleRow row : rows) {
      if (!drafts.containsKey(row.sampleName())) {
        diagnostics.record(DiagnosticKind.ORPHAN_SUBSAMPLE_ROW, row.sampleName(), null,
            "subsample row " + row.rowIndex() + " ('" + row.subsampleName() + "') names no annotated sample");
        continue;
      }
      grouped.computeIfAbsent(row.sampleName(), k -> new ArrayList<>()).add(row);
    }
    grouped.forEach((name, sampleRows) -> merge(drafts.get(name), sampleRows, indexColumn));
  }

  /**
   * Merges one sample's rows into its draft.
   *
   * @param sample draft to update
   * @param rows the sample's subsample rows, in file order
   * @param indexColumn column naming samples, excluded from merging
   * @return {@code sample}, for chaining
   */
  public SampleDraft merge(SampleDraft sample, List<SubsampleRow> rows, String indexColumn) {
    Set<String> columns = new LinkedHashSet<>();
    for (SubsampleRow row : rows) {
      sample.addSubsample(row);
      columns.addAll(row.values().keySet());
    }
    columns.remove(SampleRecord.SAMPLE_NAME);
    columns.remove(SubsampleRow.SUBSAMPLE_NAME);
    columns.remove(indexColumn);

    for (String column : columns) {
      List<String> values = new ArrayList<>();
      for (SubsampleRow row : rows) {
        row.value(column).ifPresent(values::add);
      }
      sample.set(column, values);
      sample.markMerged(column);
    }
    log.debug("Merged {} subsample rows into sample '{}' (columns {})", rows.size(), sample.sampleName(), columns);
    return sample;
  }
}
