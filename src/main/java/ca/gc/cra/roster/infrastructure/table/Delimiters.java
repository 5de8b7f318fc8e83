package ca.gc.cra.roster.infrastructure.table;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Infers a table delimiter from the file extension: comma for {@code .csv}, tab for {@code .tsv} and
 * {@code .txt}, comma otherwise.
 */
final class Delimiters {
  static final char COMMA = ',';
  static final char TAB = '\t';

  private Delimiters() {}

  static char forPath(Path path) {
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".tsv") || name.endsWith(".txt")) {
      return TAB;
    }
    return COMMA;
  }
}
