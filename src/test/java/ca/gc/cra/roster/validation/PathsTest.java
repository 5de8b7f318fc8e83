package ca.gc.cra.roster.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void outputFileCreatesMissingParent() {
    Path file = tempDir.resolve("out/nested/samples.csv");

    Path validated = Paths.validateOutputFile(file, false);

    assertEquals(file.toAbsolutePath().normalize(), validated);
    assertTrue(Files.isDirectory(tempDir.resolve("out/nested")));
  }

  @Test
  void existingOutputFileRequiresOverwrite() throws IOException {
    Path file = Files.writeString(tempDir.resolve("samples.csv"), "x");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(file, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(file.toAbsolutePath().normalize(), Paths.validateOutputFile(file, true));
  }

  @Test
  void directoryIsNotAnOutputFile() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir, true));
  }

  @Test
  void writableDirMustExistUnlessCreated() {
    Path missing = tempDir.resolve("missing");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(missing, false));
    assertEquals(missing, Paths.validateWritableDir(missing, true));
    assertTrue(Files.isDirectory(missing));
  }
}
