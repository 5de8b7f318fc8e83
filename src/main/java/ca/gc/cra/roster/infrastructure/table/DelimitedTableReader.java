package ca.gc.cra.roster.infrastructure.table;

import ca.gc.cra.roster.application.port.TableSource;
import ca.gc.cra.roster.domain.error.SampleTableException;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.exceptions.CsvValidationException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TableSource} reading comma- or tab-delimited sample tables with opencsv.
 * <p><strong>Role:</strong> Infrastructure adapter behind the roster builder's table port.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each read opens its own reader.</p>
 *
 * <p>The first non-blank line is the header. A leading UTF-8 byte order mark is dropped. Cells are trimmed,
 * blank lines are skipped, and a short line maps only the columns it carries.</p>
 *
 * @since 0.1.0
 */
public final class DelimitedTableReader implements TableSource {
  private static final Logger log = LoggerFactory.getLogger(DelimitedTableReader.class);

  @Override
  public RawTable read(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new SampleTableException("Sample table not found: " + path);
    }
    char delimiter = Delimiters.forPath(path);
    try (Reader reader = new BufferedReader(new InputStreamReader(
            BOMInputStream.builder().setInputStream(Files.newInputStream(path)).get(), StandardCharsets.UTF_8));
        CSVReader csv = new CSVReaderBuilder(reader)
            .withCSVParser(new CSVParserBuilder()
                .withSeparator(delimiter)
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .build())
            .build()) {
      List<String> header = null;
      List<Map<String, String>> rows = new ArrayList<>();
      String[] line;
      while ((line = csv.readNext()) != null) {
        if (isBlank(line)) {
          continue;
        }
        if (header == null) {
          header = trimmed(line);
          continue;
        }
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < line.length && i < header.size(); i++) {
          row.put(header.get(i), line[i].trim());
        }
        if (line.length > header.size()) {
          log.warn("Line {} of {} has {} cells but the header has {}; extra cells ignored",
              csv.getLinesRead(), path, line.length, header.size());
        }
        rows.add(row);
      }
      if (header == null) {
        throw new SampleTableException("Sample table " + path + " has no header row");
      }
      log.debug("Read {} rows x {} columns from {}", rows.size(), header.size(), path);
      return new RawTable(path, header, rows);
    } catch (IOException | CsvValidationException ex) {
      throw new SampleTableException("Unable to read sample table " + path, ex);
    }
  }

  private static boolean isBlank(String[] line) {
    for (String cell : line) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }

  private static List<String> trimmed(String[] line) {
    List<String> cells = new ArrayList<>(line.length);
    for (String cell : line) {
      cells.add(cell == null ? "" : cell.trim());
    }
    return cells;
  }
}
