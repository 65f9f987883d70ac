package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BEACON CLI dispatcher that routes to subcommands.
 *
 * @since BEACON 0.1
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: beacon <run|status|channels|reset-client> [options]";
  private static final String HELP_TEXT = """
      BEACON alert feed client

      Usage:
        beacon <command> [options]

      Commands:
        run           Connect, synchronize, and acknowledge alerts (run --help for details)
        status        Show stored subscriptions, sync state, and event counts
        channels      List the known channel keys
        reset-client  Forget the stored client id

      Global flags:
        --help        Show this message
        --verbose     Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    if (tokens.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = tokens[0] == null ? "" : tokens[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, 1, tokens.length);
    if (CliInput.parse(new String[] {command}).help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "status" -> StatusCli.run(delegateArgs);
      case "channels" -> ChannelsCli.run(delegateArgs);
      case "reset-client" -> ResetClientCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
