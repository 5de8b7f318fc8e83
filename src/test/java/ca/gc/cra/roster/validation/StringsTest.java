package ca.gc.cra.roster.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void requireNonBlankTrims() {
    assertEquals("frog_1", Strings.requireNonBlank("name", "  frog_1 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "frog\n1"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("a=b", Strings.requirePrintableAscii("attrs", "a=b", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "a=bc", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "é=1", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "a", -1));
  }

  @Test
  void requireCommaListDropsEmptyEntries() {
    assertEquals(List.of("RRBS", "WGBS"), Strings.requireCommaList("include", " RRBS,, WGBS ,"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireCommaList("include", ", ,"));
  }
}
