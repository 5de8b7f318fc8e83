package ca.gc.cra.roster.application.substitution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.roster.application.port.WildcardResolver;
import ca.gc.cra.roster.domain.error.UnresolvedVariableException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VariableExpanderTest {

  @Test
  void sampleScopeWinsOverProjectAndEnvironment() {
    ExpansionScope scope = new ExpansionScope(
        Map.of("organism", "frog"),
        Map.of("organism", "pig", "genome", "hg38"),
        Map.of("organism", "cow", "genome", "mm10", "HOME", "/home/me"));

    assertEquals("frog/hg38//home/me",
        VariableExpander.substitute("{organism}/{genome}/{HOME}", scope));
  }

  @Test
  void textWithoutPlaceholdersIsReturnedUnchanged() {
    ExpansionScope scope = ExpansionScope.projectOnly(Map.of(), Map.of());
    assertEquals("/data/plain.fq", VariableExpander.substitute("/data/plain.fq", scope));
    assertFalse(VariableExpander.hasPlaceholders("/data/plain.fq"));
    assertTrue(VariableExpander.hasPlaceholders("/data/{sample_name}.fq"));
  }

  @Test
  void replacementValuesAreLiteral() {
    ExpansionScope scope = new ExpansionScope(Map.of("dir", "C:\\data$1"), Map.of(), Map.of());
    assertEquals("C:\\data$1/x", VariableExpander.substitute("{dir}/x", scope));
  }

  @Test
  void undefinedVariableNamesTheVariable() {
    ExpansionScope scope = new ExpansionScope(Map.of("a", "1"), Map.of(), Map.of());

    UnresolvedVariableException ex = assertThrows(UnresolvedVariableException.class,
        () -> VariableExpander.substitute("/{a}/{missing}.fq", scope));

    assertEquals("missing", ex.variable());
    assertEquals("/{a}/{missing}.fq", ex.template());
  }

  @Test
  void withPriorityLayersOverSampleTier() {
    ExpansionScope scope = new ExpansionScope(Map.of("file", "a b", "run", "1"), Map.of(), Map.of());
    ExpansionScope layered = scope.withPriority(Map.of("file", "a"));

    assertEquals("a", layered.lookup("file").orElseThrow());
    assertEquals("1", layered.lookup("run").orElseThrow());
    assertEquals("a b", scope.lookup("file").orElseThrow());
  }

  @Test
  void templatesWithoutWildcardNeverTouchTheResolver() throws IOException {
    VariableExpander expander = new VariableExpander(path -> {
      throw new AssertionError("resolver should not be called for " + path);
    });

    List<String> tokens = expander.expandTokens("/x/{sample_name}.fq",
        new ExpansionScope(Map.of("sample_name", "s1"), Map.of(), Map.of()));

    assertEquals(List.of("/x/s1.fq"), tokens);
  }

  @Test
  void trailingWildcardIsResolvedAfterSubstitution() throws IOException {
    List<String> requested = new ArrayList<>();
    WildcardResolver resolver = path -> {
      requested.add(path);
      return List.of("/x/s1_R1.fq", "/x/s1_R2.fq");
    };
    VariableExpander expander = new VariableExpander(resolver);

    String joined = expander.expand("/x/{sample_name}_*.fq", Map.of("sample_name", "s1"), Map.of(), Map.of());

    assertEquals(List.of("/x/s1_*.fq"), requested);
    assertEquals("/x/s1_R1.fq /x/s1_R2.fq", joined);
  }

  @Test
  void unmatchedWildcardYieldsEmptyString() throws IOException {
    VariableExpander expander = new VariableExpander(path -> List.of());
    ExpansionScope scope = ExpansionScope.projectOnly(Map.of(), Map.of());

    assertTrue(expander.expandTokens("/x/*.fq", scope).isEmpty());
    assertEquals("", expander.expand("/x/*.fq", scope));
  }

  @Test
  void wildcardInDirectorySegmentIsNotExpanded() throws IOException {
    VariableExpander expander = new VariableExpander(path -> {
      throw new AssertionError("unexpected glob of " + path);
    });

    assertEquals("/x/*/file.fq",
        expander.expand("/x/*/file.fq", ExpansionScope.projectOnly(Map.of(), Map.of())));
  }

  @Test
  void resolverFailurePropagates() {
    VariableExpander expander = new VariableExpander(path -> {
      throw new IOException("permission denied");
    });

    assertThrows(IOException.class,
        () -> expander.expand("/x/*.fq", ExpansionScope.projectOnly(Map.of(), Map.of())));
  }
}
