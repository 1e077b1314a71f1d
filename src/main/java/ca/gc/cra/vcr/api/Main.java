package ca.gc.cra.vcr.api;

import ca.gc.cra.vcr.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cassette tooling dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: vcr <inspect|upgrade|verify> [options]";
  private static final String HELP_TEXT = """
      Cassette tooling

      Usage:
        vcr <command> [options]

      Commands:
        inspect     Summarize a cassette (inspect --help for details)
        upgrade     Persist fingerprints in a legacy cassette
        verify      Replay a server cassette against a running service

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "inspect" -> InspectCli.run(delegateArgs);
      case "upgrade" -> UpgradeCli.run(delegateArgs);
      case "verify" -> VerifyCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] delegateArgs(String[] args, String command) {
    int index = 0;
    while (index < args.length && (args[index] == null || !args[index].trim().equals(command))) {
      index++;
    }
    String[] rest = Arrays.copyOfRange(args, Math.min(index + 1, args.length), args.length);
    String[] withoutCommand = new String[index + rest.length];
    System.arraycopy(args, 0, withoutCommand, 0, index);
    System.arraycopy(rest, 0, withoutCommand, index, rest.length);
    return withoutCommand;
  }
}
