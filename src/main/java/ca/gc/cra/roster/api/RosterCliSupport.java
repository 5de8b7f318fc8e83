package ca.gc.cra.roster.api;

import ca.gc.cra.roster.application.port.MetricsPort;
import ca.gc.cra.roster.application.roster.ProjectResolver;
import ca.gc.cra.roster.application.roster.SampleRoster;
import ca.gc.cra.roster.config.CompositionRoot;
import ca.gc.cra.roster.domain.error.ConfigLoadException;
import ca.gc.cra.roster.domain.error.DuplicateSampleNameException;
import ca.gc.cra.roster.domain.error.SampleNotFoundException;
import ca.gc.cra.roster.domain.error.SampleTableException;
import ca.gc.cra.roster.domain.error.UnknownAmendmentException;
import ca.gc.cra.roster.logging.LoggingConfigurator;
import ca.gc.cra.roster.validation.Strings;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared flow of the roster commands: flag handling, argument parsing, telemetry setup, and the mapping of
 * resolution failures to exit codes.
 */
final class RosterCliSupport {
  private static final Logger log = LoggerFactory.getLogger(RosterCliSupport.class);

  private RosterCliSupport() {}

  /**
   * Body of a command once arguments are parsed and adapters are wired.
   */
  @FunctionalInterface
  interface Command {
    ExitCode run(CliInput input, Map<String, String> args, CompositionRoot root);
  }

  static ExitCode execute(String name, String[] rawArgs, String usage, String help, Command command) {
    CliInput input = CliInput.parse(rawArgs);
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", name);
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }

    Map<String, String> args;
    MetricsPort metrics;
    try {
      args = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      metrics = TelemetryConfigurator.configureMetrics(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    try {
      return command.run(input, args, new CompositionRoot(metrics));
    } catch (UnknownAmendmentException | SampleNotFoundException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", name, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (ConfigLoadException | DuplicateSampleNameException ex) {
      log.error("Project configuration error: {}", ex.getMessage(), ex.getCause());
      return ExitCode.CONFIG_ERROR;
    } catch (SampleTableException ex) {
      log.error("Sample table error: {}", ex.getMessage(), ex.getCause());
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in {} command", name, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.close(metrics);
    }
  }

  /**
   * Consumes {@code config=} and the optional {@code amendment=} argument and resolves the roster.
   *
   * @param args parsed arguments; consumed keys are removed
   * @param resolver project resolver
   * @return resolved roster
   */
  static SampleRoster resolve(Map<String, String> args, ProjectResolver resolver) {
    Path config = Path.of(CliArgsParser.require(args, "config"));
    String amendment = args.remove("amendment");
    if (amendment != null) {
      amendment = Strings.requireNonBlank("amendment", amendment);
    }
    return resolver.resolve(config, amendment);
  }
}
