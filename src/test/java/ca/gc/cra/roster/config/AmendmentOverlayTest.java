package ca.gc.cra.roster.config;

import static ca.gc.cra.roster.testutil.ProjectFixtures.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.roster.application.port.EnvironmentPort;
import ca.gc.cra.roster.domain.error.UnknownAmendmentException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AmendmentOverlayTest {
  @TempDir Path tempDir;

  private ProjectConfig base;

  @BeforeEach
  void setUp() throws IOException {
    Path config = write(tempDir, "project_config.yaml",
        "name: frogs",
        "description: base description",
        "tags: [a, b, c]",
        "metadata:",
        "  sample_annotation: annotation.csv",
        "  output_dir: out",
        "amendments:",
        "  newLib:",
        "    metadata:",
        "      sample_annotation: libs/annotation_newlib.csv",
        "    tags: [z]",
        "  newLib2:",
        "    description: second library",
        "subprojects:",
        "  legacy:",
        "    genome: hg19",
        "  newLib:",
        "    description: ignored because amendments win");
    base = new ProjectConfigLoader(EnvironmentPort.of(Map.of())).load(config);
  }

  @Test
  void deepMergesMetadataAndKeepsUntouchedKeys() throws IOException {
    ProjectConfig active = base.activate("newLib");

    assertEquals(tempDir.toRealPath().resolve("libs/annotation_newlib.csv"),
        active.metadata().sampleAnnotation());
    assertEquals(base.metadata().output(), active.metadata().output());
    assertEquals("base description", active.description().orElseThrow());
    assertEquals(List.of("z"), active.tree().get("tags"));
    assertEquals("newLib", active.activeAmendment().orElseThrow());
  }

  @Test
  void activationDoesNotStack() {
    ProjectConfig viaFirst = base.activate("newLib").activate("newLib2");
    ProjectConfig direct = base.activate("newLib2");

    assertEquals(direct, viaFirst);
    assertEquals(base.metadata().sampleAnnotation(), viaFirst.metadata().sampleAnnotation());
    assertEquals("second library", viaFirst.description().orElseThrow());
  }

  @Test
  void deactivateRestoresBase() {
    ProjectConfig active = base.activate("newLib");

    assertEquals(base, active.deactivate());
    assertSame(base, base.deactivate());
    assertEquals(base.tree(), active.baseTree());
  }

  @Test
  void unknownAmendmentListsDeclaredNames() {
    UnknownAmendmentException ex = assertThrows(UnknownAmendmentException.class,
        () -> base.activate("nope"));

    assertEquals("nope", ex.amendment());
    assertEquals(List.of("newLib", "newLib2", "legacy"), ex.declared());
    assertTrue(base.activeAmendment().isEmpty());
  }

  @Test
  void subprojectsAreActivatableAndLoseNameClashes() {
    assertEquals(List.of("newLib", "newLib2", "legacy"), base.amendmentNames());
    assertEquals("hg19", base.activate("legacy").projectScope().get("genome"));
    assertEquals("base description", base.activate("newLib").description().orElseThrow());
  }

  @Test
  void overlayCanNotReintroduceAmendments() throws IOException {
    Path config = write(tempDir, "nested/project_config.yaml",
        "metadata:",
        "  sample_annotation: annotation.csv",
        "amendments:",
        "  outer:",
        "    amendments:",
        "      inner:",
        "        genome: hg38");
    ProjectConfig loaded = new ProjectConfigLoader(EnvironmentPort.of(Map.of())).load(config);

    ProjectConfig active = loaded.activate("outer");

    assertEquals(List.of("outer"), active.amendmentNames());
    assertThrows(UnknownAmendmentException.class, () -> active.activate("inner"));
  }
}
