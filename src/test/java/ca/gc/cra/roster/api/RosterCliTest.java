package ca.gc.cra.roster.api;

import static ca.gc.cra.roster.testutil.ProjectFixtures.frogProject;
import static ca.gc.cra.roster.testutil.ProjectFixtures.lines;
import static ca.gc.cra.roster.testutil.ProjectFixtures.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RosterCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;
  private Path config;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(RosterCliSupport.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    config = frogProject(tempDir);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void inspectPrintsProjectSummary() {
    ExitCode code = Main.run(new String[] {"inspect", "config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Project:"), out);
    assertTrue(out.contains("frogs"));
    assertTrue(out.contains("newLib, newLib2"));
    assertTrue(out.matches("(?s).*Samples:\\s+4.*"), out);
    assertTrue(out.matches("(?s).*Diagnostics:\\s+0.*"), out);
  }

  @Test
  void inspectWithAmendmentReportsActiveAmendment() {
    ExitCode code = InspectCli.run(new String[] {"config=" + config, "amendment=newLib2"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().matches("(?s).*Active:\\s+newLib2.*"), buffer.toString());
    assertTrue(buffer.toString().contains("second library"));
  }

  @Test
  void sampleCommandPrintsAttributesAndSubsamples() {
    ExitCode code = Main.run(new String[] {"sample", "config=" + config, "name=frog_1"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.matches("(?s).*file:\\s+a\\.txt b\\.txt c\\.txt.*"), out);
    assertTrue(out.contains("subsample sub_b:"), out);
  }

  @Test
  void unknownSampleIsInvalidArgs() {
    ExitCode code = SampleCli.run(new String[] {"config=" + config, "name=toad"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "toad"));
  }

  @Test
  void unknownAmendmentIsInvalidArgs() {
    ExitCode code = InspectCli.run(new String[] {"config=" + config, "amendment=missing"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "missing"));
  }

  @Test
  void missingConfigArgumentPrintsUsage() {
    ExitCode code = InspectCli.run(new String[] {});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: inspect"));
  }

  @Test
  void unknownArgumentIsRejected() {
    ExitCode code = InspectCli.run(new String[] {"config=" + config, "bogus=1"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "bogus"));
  }

  @Test
  void invalidExporterIsRejected() {
    ExitCode code = InspectCli.run(new String[] {"config=" + config, "metricsExporter=prometheus"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: inspect"));
  }

  @Test
  void malformedConfigIsConfigError() throws IOException {
    Path broken = write(tempDir, "broken/project_config.yaml", "metadata: [unclosed");

    assertEquals(ExitCode.CONFIG_ERROR, InspectCli.run(new String[] {"config=" + broken}));
  }

  @Test
  void missingAnnotationIsIoError() throws IOException {
    Path orphan = write(tempDir, "orphan/project_config.yaml",
        "metadata:",
        "  sample_annotation: nowhere.csv");

    assertEquals(ExitCode.IO_ERROR, InspectCli.run(new String[] {"config=" + orphan}));
  }

  @Test
  void exportDefaultsToOutputDirectory() throws IOException {
    ExitCode code = Main.run(new String[] {"export", "config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
    Path written = tempDir.toRealPath().resolve("out/frogs_samples.csv");
    assertTrue(Files.exists(written), buffer.toString());
    List<String> rows = lines(written);
    assertEquals("sample_name,protocol,organism,time,file,_key_file", rows.get(0));
    assertEquals("frog_1,anySampleType,frog,0,a.txt b.txt c.txt,a.txt b.txt c.txt", rows.get(1));
    assertEquals("frog_2,anySampleType,frog,1,/x/frog_1h.fastq,src1", rows.get(2));
    assertEquals(5, rows.size());
  }

  @Test
  void exportWithAmendmentAndSelection() throws IOException {
    Path out = tempDir.resolve("selected.tsv");

    ExitCode code = ExportCli.run(new String[] {
        "config=" + config, "amendment=newLib2", "out=" + out, "select=organism", "include=pig"});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> rows = lines(out);
    assertEquals(3, rows.size());
    assertTrue(rows.get(1).startsWith("pig_0h\t"));
  }

  @Test
  void exportRefusesToOverwriteWithoutFlag() throws IOException {
    Path out = write(tempDir, "existing.csv", "keep me");

    ExitCode refused = ExportCli.run(new String[] {"config=" + config, "out=" + out});
    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertEquals(List.of("keep me"), lines(out));

    ExitCode replaced = ExportCli.run(new String[] {"config=" + config, "out=" + out, "--allow-overwrite"});
    assertEquals(ExitCode.SUCCESS, replaced);
    assertFalse(lines(out).contains("keep me"));
  }

  @Test
  void exportFilterWithoutSelectIsInvalid() {
    ExitCode code = ExportCli.run(new String[] {"config=" + config, "include=pig"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: export"));
  }

  @Test
  void helpPrintsCommandOptions() {
    assertEquals(ExitCode.SUCCESS, ExportCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("--allow-overwrite"));
  }

  @Test
  void dispatcherRejectsMissingAndUnknownCommands() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {}));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"frobnicate", "config=x"}));
    assertTrue(buffer.toString().contains("usage: roster"));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }
}
