package ca.gc.cra.roster.infrastructure.table;

import ca.gc.cra.roster.domain.error.SampleTableException;
import ca.gc.cra.roster.domain.sample.SampleTable;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes a {@link SampleTable} as a delimited file, choosing the delimiter from the file extension.
 *
 * @since 0.1.0
 */
public final class DelimitedTableWriter {

  /**
   * Writes {@code table} to {@code path}, replacing any existing file.
   *
   * @param table table to write
   * @param path destination
   * @throws SampleTableException when the file cannot be written
   */
  public void write(SampleTable table, Path path) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(path, "path");
    char delimiter = Delimiters.forPath(path);
    try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        CSVWriter csv = new CSVWriter(out, delimiter, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
            ICSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n")) {
      csv.writeNext(table.columns().toArray(new String[0]), false);
      for (List<String> row : table.rows()) {
        csv.writeNext(row.toArray(new String[0]), false);
      }
      csv.flush();
      if (csv.checkError()) {
        throw new SampleTableException("Failed writing sample table " + path);
      }
    } catch (IOException ex) {
      throw new SampleTableException("Unable to write sample table " + path, ex);
    }
  }
}
