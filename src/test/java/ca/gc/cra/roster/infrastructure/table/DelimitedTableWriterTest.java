package ca.gc.cra.roster.infrastructure.table;

import static ca.gc.cra.roster.testutil.ProjectFixtures.lines;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.roster.domain.error.SampleTableException;
import ca.gc.cra.roster.domain.sample.SampleTable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DelimitedTableWriterTest {
  @TempDir Path tempDir;

  private final DelimitedTableWriter writer = new DelimitedTableWriter();

  private final SampleTable table = new SampleTable(List.of("sample_name", "file", "note"), List.of(
      List.of("frog_1", "a.txt b.txt", ""),
      List.of("frog_2", "c.txt", "has, comma")));

  @Test
  void writesCsvQuotingOnlyWhenNeeded() throws IOException {
    Path out = tempDir.resolve("samples.csv");

    writer.write(table, out);

    assertEquals(List.of(
        "sample_name,file,note",
        "frog_1,a.txt b.txt,",
        "frog_2,c.txt,\"has, comma\""), lines(out));
  }

  @Test
  void writesTsvForTsvExtension() throws IOException {
    Path out = tempDir.resolve("samples.tsv");

    writer.write(table, out);

    assertEquals("frog_2\tc.txt\thas, comma", lines(out).get(2));
  }

  @Test
  void writtenTableReadsBack() {
    Path out = tempDir.resolve("samples.csv");
    writer.write(table, out);

    assertEquals("has, comma", new DelimitedTableReader().read(out).rows().get(1).get("note"));
  }

  @Test
  void unwritableDestinationIsTableError() {
    assertThrows(SampleTableException.class, () -> writer.write(table, tempDir.resolve("missing/samples.csv")));
  }
}
