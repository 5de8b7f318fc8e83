package ca.gc.cra.roster.api;

import ca.gc.cra.roster.application.roster.SampleRoster;
import ca.gc.cra.roster.config.CompositionRoot;
import ca.gc.cra.roster.config.ProjectConfig;
import ca.gc.cra.roster.domain.diagnostics.Diagnostic;
import java.util.Map;

/**
 * {@code roster inspect}: resolves a project and prints its summary and diagnostics.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final String SUMMARY_USAGE =
      "usage: inspect config=PATH [amendment=NAME] [metricsExporter=otlp|none] [--verbose|--quiet]";
  private static final String HELP_TEXT = """
      Roster inspect

      Usage:
        inspect config=project_config.yaml [amendment=NAME]

      Required:
        config=PATH              Project descriptor (YAML)

      Optional:
        amendment=NAME           Activate a declared amendment or subproject
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --quiet                  Only log warnings and errors
        --help                   Show this message
      """;

  private InspectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return RosterCliSupport.execute("inspect", args, SUMMARY_USAGE, HELP_TEXT, InspectCli::inspect);
  }

  private static ExitCode inspect(CliInput input, Map<String, String> args, CompositionRoot root) {
    SampleRoster roster = RosterCliSupport.resolve(args, root.projectResolver());
    CliArgsParser.rejectUnknown(args);

    ProjectConfig config = roster.config();
    CliPrinter.field("Project", config.name());
    config.description().ifPresent(description -> CliPrinter.field("Description", description));
    CliPrinter.field("Config", config.configFile());
    CliPrinter.field("Amendments",
        roster.amendmentNames().isEmpty() ? "none" : String.join(", ", roster.amendmentNames()));
    CliPrinter.field("Active", roster.activeAmendment().orElse("none"));
    CliPrinter.field("Samples", roster.size());
    CliPrinter.field("Attributes", String.join(", ", roster.toTable().columns()));
    CliPrinter.field("Diagnostics", roster.diagnostics().size());
    for (Diagnostic diagnostic : roster.diagnostics()) {
      CliPrinter.println("  - " + diagnostic);
    }
    return ExitCode.SUCCESS;
  }
}
