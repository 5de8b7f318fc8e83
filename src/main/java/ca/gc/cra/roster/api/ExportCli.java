package ca.gc.cra.roster.api;

import ca.gc.cra.roster.application.roster.SampleRoster;
import ca.gc.cra.roster.config.CompositionRoot;
import ca.gc.cra.roster.domain.sample.SampleRecord;
import ca.gc.cra.roster.domain.sample.SampleTable;
import ca.gc.cra.roster.validation.Paths;
import ca.gc.cra.roster.validation.Strings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code roster export}: writes the resolved sample table as CSV or TSV, optionally filtered on one attribute.
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: export config=PATH [amendment=NAME] [out=FILE] [select=ATTR include=V,...|exclude=V,...] "
          + "[--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Roster export

      Usage:
        export config=project_config.yaml [out=samples.tsv] [options]

      Required:
        config=PATH              Project descriptor (YAML)

      Optional:
        out=FILE                 Destination; .tsv/.txt write tabs, anything else commas.
                                 Defaults to <output_dir>/<project>[_<amendment>]_samples.csv
        amendment=NAME           Activate a declared amendment or subproject
        select=ATTR              Attribute to filter on (with include= or exclude=)
        include=V1,V2            Keep samples whose ATTR value is listed
        exclude=V1,V2            Drop samples whose ATTR value is listed
        --allow-overwrite        Replace an existing destination file
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ExportCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return RosterCliSupport.execute("export", args, SUMMARY_USAGE, HELP_TEXT, ExportCli::export);
  }

  private static ExitCode export(CliInput input, Map<String, String> args, CompositionRoot root) {
    String out = args.remove("out");
    String select = args.remove("select");
    String include = args.remove("include");
    String exclude = args.remove("exclude");
    if (select == null && (include != null || exclude != null)) {
      throw new IllegalArgumentException("include=/exclude= require select=ATTR");
    }
    SampleRoster roster = RosterCliSupport.resolve(args, root.projectResolver());
    CliArgsParser.rejectUnknown(args);

    List<SampleRecord> samples = select == null
        ? roster.samples()
        : roster.select(Strings.requireNonBlank("select", select),
            include == null ? null : Strings.requireCommaList("include", include),
            exclude == null ? null : Strings.requireCommaList("exclude", exclude));

    Path destination = Paths.validateOutputFile(destination(roster, out), input.hasFlag("--allow-overwrite"));
    root.tableWriter().write(SampleTable.from(samples), destination);
    log.info("Exported {} of {} samples to {}", samples.size(), roster.size(), destination);
    CliPrinter.println(destination.toString());
    return ExitCode.SUCCESS;
  }

  private static Path destination(SampleRoster roster, String out) {
    if (out != null) {
      return Path.of(out);
    }
    Path outputDir = roster.config().metadata().output()
        .orElseThrow(() -> new IllegalArgumentException("out=FILE is required when metadata.output_dir is unset"));
    String stem = roster.config().name() + roster.activeAmendment().map(a -> "_" + a).orElse("");
    return outputDir.resolve(stem + "_samples.csv");
  }
}
