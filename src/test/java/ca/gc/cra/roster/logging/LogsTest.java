package ca.gc.cra.roster.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void truncateKeepsShortValues() {
    String value = "frog_1";
    assertSame(value, Logs.truncate(value, 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void truncateReportsOriginalSize() {
    assertEquals("abcd... (truncated, 4 of 10 bytes)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncateDoesNotSplitCodepoints() {
    String truncated = Logs.truncate("ééé", 3);
    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void summarizeCapsTokenCount() {
    assertEquals("a b", Logs.summarize(List.of("a", "b"), 2));
    assertEquals("a b ... (+3 more)", Logs.summarize(List.of("a", "b", "c", "d", "e"), 2));
    assertThrows(IllegalArgumentException.class, () -> Logs.summarize(List.of("a"), 0));
  }
}
