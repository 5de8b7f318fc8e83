package ca.gc.cra.roster.api;

import ca.gc.cra.roster.application.roster.SampleRoster;
import ca.gc.cra.roster.config.CompositionRoot;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import ca.gc.cra.roster.domain.sample.SubsampleRow;
import ca.gc.cra.roster.validation.Strings;
import java.util.Map;

/**
 * {@code roster sample}: prints every resolved attribute of one sample, plus its subsamples.
 *
 * @since 0.1.0
 */
public final class SampleCli {
  private static final String SUMMARY_USAGE =
      "usage: sample config=PATH name=SAMPLE [amendment=NAME] [metricsExporter=otlp|none] [--verbose|--quiet]";
  private static final String HELP_TEXT = """
      Roster sample

      Usage:
        sample config=project_config.yaml name=frog_1 [amendment=NAME]

      Required:
        config=PATH              Project descriptor (YAML)
        name=SAMPLE              Sample to print

      Optional:
        amendment=NAME           Activate a declared amendment or subproject
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose                Enable DEBUG logging
        --quiet                  Only log warnings and errors
        --help                   Show this message
      """;

  private SampleCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return RosterCliSupport.execute("sample", args, SUMMARY_USAGE, HELP_TEXT, SampleCli::printSample);
  }

  private static ExitCode printSample(CliInput input, Map<String, String> args, CompositionRoot root) {
    String name = Strings.requireNonBlank("name", CliArgsParser.require(args, "name"));
    SampleRoster roster = RosterCliSupport.resolve(args, root.projectResolver());
    CliArgsParser.rejectUnknown(args);

    SampleRecord sample = roster.sample(name);
    sample.asMap().forEach(CliPrinter::field);
    for (SubsampleRow row : sample.subsamples()) {
      CliPrinter.println("  subsample " + row.subsampleName() + ": " + row.values());
    }
    return ExitCode.SUCCESS;
  }
}
