package ca.gc.cra.roster.application.port;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Port reading delimited sample and subsample tables.
 *
 * @since 0.1.0
 */
public interface TableSource {
  /**
   * Reads a delimited table.
   *
   * @param path table location
   * @return parsed header and rows in file order
   * @throws ca.gc.cra.roster.domain.error.SampleTableException when the file is unreadable or has no header
   */
  RawTable read(Path path);

  /**
   * Header plus rows of a delimited table. Each row maps only the cells the line actually carries, so
   * a short line leaves trailing columns absent.
   *
   * @param source file the table came from
   * @param header column names in file order
   * @param rows rows in file order
   */
  record RawTable(Path source, List<String> header, List<Map<String, String>> rows) {
    public RawTable {
      Objects.requireNonNull(source, "source");
      header = List.copyOf(header);
      rows = rows.stream()
          .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
          .toList();
    }

    public boolean hasColumn(String column) {
      return header.contains(column);
    }
  }
}
