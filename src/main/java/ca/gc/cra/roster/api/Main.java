package ca.gc.cra.roster.api;

import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Roster CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: roster <inspect|sample|export> config=PATH [options]";
  private static final String HELP_TEXT = """
      PEP roster resolver

      Usage:
        roster <command> config=PATH [options]

      Commands:
        inspect     Summarize a project: amendments, sample count, attributes, diagnostics
        sample      Print the resolved attributes of one sample
        export      Write the resolved sample table as CSV or TSV

      Global flags:
        --help      Show this message (or a command's options with <command> --help)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      if (CliInput.parse(safeArgs).help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);

    return switch (command) {
      case "inspect" -> InspectCli.run(delegateArgs);
      case "sample" -> SampleCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {} (args {})", command, Arrays.toString(delegateArgs));
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
