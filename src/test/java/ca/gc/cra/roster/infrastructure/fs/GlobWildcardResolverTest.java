package ca.gc.cra.roster.infrastructure.fs;

import static ca.gc.cra.roster.testutil.ProjectFixtures.touch;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GlobWildcardResolverTest {
  @TempDir Path tempDir;

  private final GlobWildcardResolver resolver = new GlobWildcardResolver();

  @Test
  void matchesTrailingSegmentInLexicalOrder() throws IOException {
    touch(tempDir, "s1_R2.fq");
    touch(tempDir, "s1_R1.fq");
    touch(tempDir, "s2_R1.fq");
    touch(tempDir, "s1_R1.bam");

    List<String> matches = resolver.expand(tempDir + "/s1_*.fq");

    assertEquals(List.of(tempDir.resolve("s1_R1.fq").toString(), tempDir.resolve("s1_R2.fq").toString()),
        matches);
  }

  @Test
  void supportsCharacterClassesAndSingleCharacterWildcards() throws IOException {
    touch(tempDir, "lane1.fq");
    touch(tempDir, "lane2.fq");
    touch(tempDir, "lane10.fq");

    assertEquals(2, resolver.expand(tempDir + "/lane?.fq").size());
    assertEquals(List.of(tempDir.resolve("lane2.fq").toString()), resolver.expand(tempDir + "/lane[2-3].fq"));
  }

  @Test
  void noMatchYieldsEmptyList() throws IOException {
    assertTrue(resolver.expand(tempDir + "/*.bam").isEmpty());
  }

  @Test
  void missingParentYieldsEmptyList() throws IOException {
    assertTrue(resolver.expand(tempDir + "/absent/*.fq").isEmpty());
  }

  @Test
  void hiddenFilesMatchOnlyDotPatterns() throws IOException {
    touch(tempDir, "r1.fq");
    touch(tempDir, ".r1.fq.swp.fq");

    assertEquals(List.of(tempDir.resolve("r1.fq").toString()), resolver.expand(tempDir + "/*.fq"));
    assertEquals(List.of(tempDir.resolve(".r1.fq.swp.fq").toString()), resolver.expand(tempDir + "/.*.fq"));
  }
}
