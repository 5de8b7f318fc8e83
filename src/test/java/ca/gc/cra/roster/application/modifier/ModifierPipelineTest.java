package ca.gc.cra.roster.application.modifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.roster.application.merge.SubsampleMerger;
import ca.gc.cra.roster.application.port.WildcardResolver;
import ca.gc.cra.roster.application.substitution.VariableExpander;
import ca.gc.cra.roster.config.DerivedAttributeSpec;
import ca.gc.cra.roster.config.ImpliedAttributeSpec;
import ca.gc.cra.roster.config.SampleModifiers;
import ca.gc.cra.roster.domain.diagnostics.Diagnostic;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticKind;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticsCollector;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import ca.gc.cra.roster.domain.sample.SubsampleRow;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ModifierPipelineTest {
  private static final Map<String, String> SOURCES = Map.of(
      "src1", "/x/{organism}_{time}h.fastq",
      "src2", "/y/{sample_name}_{genome}.bam",
      "glob", "/z/{sample_name}_*.fq",
      "subsrc", "/runs/{run}/{file}.fq",
      "subglob", "/runs/{run}/*.fq");

  private DiagnosticsCollector diagnostics;
  private ResolutionContext context;

  @BeforeEach
  void setUp() {
    diagnostics = new DiagnosticsCollector();
    context = new ResolutionContext(Map.of("genome", "hg38"), Map.of("HOME", "/home/me"), diagnostics);
  }

  @Test
  void stagesRunInFixedOrder() {
    ModifierPipeline pipeline = ModifierPipeline.from(SampleModifiers.none(), new VariableExpander(resolver(List.of())));
    assertEquals(List.of("append", "duplicate", "derive", "imply", "remove"), pipeline.stageNames());
  }

  @Test
  void appendOnlyFillsMissingAttributes() {
    SampleDraft sample = sample("s1", "read_type", "PAIRED");

    run(modifiers(Map.of("read_type", List.of("SINGLE"), "tags", List.of("a", "b")), Map.of(), List.of(),
        List.of(), List.of()), sample);

    assertEquals("PAIRED", sample.value("read_type"));
    assertEquals(List.of("a", "b"), sample.values("tags"));
    assertTrue(diagnostics.diagnostics().isEmpty());
  }

  @Test
  void duplicateCopiesAndReportsMissingSource() {
    SampleDraft sample = sample("s1", "organism", "frog");

    run(modifiers(Map.of(), linked("organism", "animal", "protocol", "assay"), List.of(), List.of(), List.of()),
        sample);

    assertEquals("frog", sample.value("animal"));
    assertEquals("frog", sample.value("organism"));
    assertFalse(sample.has("assay"));
    assertEquals(List.of(DiagnosticKind.MISSING_DUPLICATE_SOURCE), kinds());
  }

  @Test
  void duplicateIntoExistingTargetUsesFirstFreeSuffix() {
    SampleDraft sample = sample("s1", "organism", "frog");
    sample.set("animal", "toad");
    sample.set("animal_1", "newt");

    run(modifiers(Map.of(), Map.of("organism", "animal"), List.of(), List.of(), List.of()), sample);

    assertEquals("toad", sample.value("animal"));
    assertEquals("newt", sample.value("animal_1"));
    assertEquals("frog", sample.value("animal_2"));
    Diagnostic renamed = diagnostics.diagnostics().get(0);
    assertEquals(DiagnosticKind.DUPLICATE_TARGET_RENAMED, renamed.kind());
    assertTrue(renamed.message().contains("animal_2"));
  }

  @Test
  void deriveExpandsEachTokenAndKeepsUnknownOnes() {
    SampleDraft sample = sample("pig_0h", "organism", "pig");
    sample.set("time", "0");
    sample.set("file", List.of("src1", "raw.fq", "src2"));

    run(derive("file"), sample);

    assertEquals(List.of("/x/pig_0h.fastq", "raw.fq", "/y/pig_0h_hg38.bam"), sample.values("file"));
    assertEquals(List.of("src1", "raw.fq", "src2"), sample.values("_key_file"));
    assertTrue(diagnostics.diagnostics().isEmpty());
  }

  @Test
  void deriveUsesAppendedAndDuplicatedValues() {
    SampleDraft sample = sample("pig_1h", "organism", "pig");
    sample.set("time", "1");
    SampleModifiers modifiers = new SampleModifiers(
        Map.of("file", List.of("src1")),
        Map.of("file", "raw_file"),
        List.of(new DerivedAttributeSpec("file", SOURCES)),
        List.of(),
        List.of());

    run(modifiers, sample);

    assertEquals("/x/pig_1h.fastq", sample.value("file"));
    assertEquals("src1", sample.value("raw_file"));
  }

  @Test
  void unresolvedVariableKeepsOriginalValue() {
    SampleDraft sample = sample("frog_2", "organism", "frog");
    sample.set("file", List.of("src2", "src1"));

    run(derive("file"), sample);

    assertEquals(List.of("src2", "src1"), sample.values("file"));
    assertFalse(sample.has("_key_file"));
    Diagnostic diagnostic = diagnostics.diagnostics().get(0);
    assertEquals(DiagnosticKind.UNRESOLVED_VARIABLE, diagnostic.kind());
    assertEquals("frog_2", diagnostic.sampleName());
    assertEquals("file", diagnostic.attribute());
    assertTrue(diagnostic.message().contains("time"));
  }

  @Test
  void wildcardMatchesBecomeSeparateTokens() {
    SampleDraft sample = sample("s1", "file", "glob");

    runWith(resolver(List.of("/z/s1_R1.fq", "/z/s1_R2.fq")), derive("file"), sample);

    assertEquals(List.of("/z/s1_R1.fq", "/z/s1_R2.fq"), sample.values("file"));
    assertEquals("/z/s1_R1.fq /z/s1_R2.fq", sample.value("file"));
  }

  @Test
  void unmatchedWildcardYieldsEmptyValueAndDiagnostic() {
    SampleDraft sample = sample("s1", "file", "glob");

    runWith(resolver(List.of()), derive("file"), sample);

    assertTrue(sample.has("file"));
    assertEquals("", sample.value("file"));
    assertEquals(List.of(DiagnosticKind.UNMATCHED_WILDCARD), kinds());
    assertTrue(diagnostics.diagnostics().get(0).message().contains("/z/s1_*.fq"));
  }

  @Test
  void wildcardFailureKeepsOriginalValue() {
    SampleDraft sample = sample("s1", "file", "glob");
    WildcardResolver failing = path -> {
      throw new IOException("permission denied");
    };

    runWith(failing, derive("file"), sample);

    assertEquals("glob", sample.value("file"));
    assertEquals(List.of(DiagnosticKind.WILDCARD_FAILURE), kinds());
  }

  @Test
  void mergedTokensExpandWithTheirOwnSubsampleRow() {
    SampleDraft sample = sample("frog_1", "file", "multi");
    new SubsampleMerger().merge(sample, List.of(
        row("frog_1", "a", 0, "file", "subsrc", "run", "1"),
        row("frog_1", "b", 1, "file", "subsrc", "run", "2")), "sample_name");

    runWith(path -> {
      throw new AssertionError("subsample tokens are never globbed");
    }, derive("file"), sample);

    assertEquals(List.of("/runs/1/subsrc.fq", "/runs/2/subsrc.fq"), sample.values("file"));
    assertTrue(diagnostics.diagnostics().isEmpty());
  }

  @Test
  void wildcardInSubsampleTokenIsFlaggedAndKeptVerbatim() {
    SampleDraft sample = sample("frog_1", "file", "multi");
    new SubsampleMerger().merge(sample, List.of(
        row("frog_1", "a", 0, "file", "subglob", "run", "1"),
        row("frog_1", "b", 1, "file", "raw.fq", "run", "2")), "sample_name");

    runWith(path -> {
      throw new AssertionError("subsample tokens are never globbed");
    }, derive("file"), sample);

    assertEquals(List.of("/runs/1/*.fq", "raw.fq"), sample.values("file"));
    assertEquals(List.of(DiagnosticKind.SUBSAMPLE_WILDCARD_CONFLICT), kinds());
  }

  @Test
  void implicationsApplyInOrderAndLaterRulesWin() {
    SampleDraft human = sample("h1", "organism", "human");
    SampleDraft mouse = sample("m1", "organism", "mouse");
    SampleModifiers modifiers = modifiers(Map.of(), Map.of(), List.of(), List.of(
        new ImpliedAttributeSpec(Map.of("organism", List.of("human", "Homo sapiens")),
            Map.of("genome", List.of("hg19"))),
        new ImpliedAttributeSpec(Map.of("organism", List.of("human")),
            Map.of("genome", List.of("hg38"), "macs_genome_size", List.of("hs")))),
        List.of());

    run(modifiers, human);
    run(modifiers, mouse);

    assertEquals("hg38", human.value("genome"));
    assertEquals("hs", human.value("macs_genome_size"));
    assertFalse(mouse.has("genome"));
  }

  @Test
  void implicationRequiresEveryCondition() {
    SampleDraft sample = sample("h1", "organism", "human");
    SampleModifiers modifiers = modifiers(Map.of(), Map.of(), List.of(), List.of(
        new ImpliedAttributeSpec(linkedLists("organism", List.of("human"), "protocol", List.of("RRBS")),
            Map.of("genome", List.of("hg38")))),
        List.of());

    run(modifiers, sample);

    assertFalse(sample.has("genome"));
  }

  @Test
  void removeRunsLastAndProtectsSampleName() {
    SampleDraft sample = sample("h1", "organism", "human");
    SampleModifiers modifiers = modifiers(Map.of("scratch", List.of("x")), Map.of(), List.of(), List.of(
        new ImpliedAttributeSpec(Map.of("organism", List.of("human")), Map.of("genome", List.of("hg38")))),
        List.of("genome", "scratch", "sample_name", "never_there"));

    run(modifiers, sample);

    assertEquals("h1", sample.sampleName());
    assertFalse(sample.has("genome"));
    assertFalse(sample.has("scratch"));
    assertEquals(List.of(DiagnosticKind.PROTECTED_ATTRIBUTE), kinds());
  }

  private void run(SampleModifiers modifiers, SampleDraft sample) {
    runWith(resolver(List.of()), modifiers, sample);
  }

  private void runWith(WildcardResolver resolver, SampleModifiers modifiers, SampleDraft sample) {
    ModifierPipeline.from(modifiers, new VariableExpander(resolver)).apply(sample, context);
  }

  private List<DiagnosticKind> kinds() {
    return diagnostics.diagnostics().stream().map(Diagnostic::kind).toList();
  }

  private static WildcardResolver resolver(List<String> matches) {
    return path -> matches;
  }

  private static SampleModifiers derive(String attribute) {
    return modifiers(Map.of(), Map.of(), List.of(new DerivedAttributeSpec(attribute, SOURCES)), List.of(),
        List.of());
  }

  private static SampleModifiers modifiers(Map<String, List<String>> append, Map<String, String> duplicate,
      List<DerivedAttributeSpec> derive, List<ImpliedAttributeSpec> imply, List<String> remove) {
    return new SampleModifiers(append, duplicate, derive, imply, remove);
  }

  private static SampleDraft sample(String name, String attribute, String value) {
    SampleDraft draft = new SampleDraft();
    draft.set("sample_name", name);
    draft.set(attribute, value);
    return draft;
  }

  private static SubsampleRow row(String sample, String subsample, int index, String... cells) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("sample_name", sample);
    values.put("subsample_name", subsample);
    for (int i = 0; i < cells.length; i += 2) {
      values.put(cells[i], cells[i + 1]);
    }
    return new SubsampleRow(sample, subsample, index, values);
  }

  private static Map<String, String> linked(String... pairs) {
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return map;
  }

  private static Map<String, List<String>> linkedLists(String k1, List<String> v1, String k2, List<String> v2) {
    Map<String, List<String>> map = new LinkedHashMap<>();
    map.put(k1, v1);
    map.put(k2, v2);
    return map;
  }
}
