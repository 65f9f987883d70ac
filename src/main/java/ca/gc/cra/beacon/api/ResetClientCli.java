package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.CompositionRoot;
import ca.gc.cra.beacon.config.FeedConfig;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes the persisted client id so the next {@code run} registers as a new client.
 */
public final class ResetClientCli {
  private static final Logger log = LoggerFactory.getLogger(ResetClientCli.class);
  private static final String SUMMARY_USAGE = "usage: reset-client [stateDir=PATH] [config=PATH]";

  private ResetClientCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    FeedConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.settingArgs());
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("reset-client", kv);
      ConfigCliUtils.applyLogging(effective);
      config = FeedConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid reset-client arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      Optional<String> previous = root.clientIds().current();
      if (root.clientIds().reset()) {
        log.info("Removed client id {}", previous.orElse("<unknown>"));
        CliPrinter.println("Client id " + previous.orElse("<unknown>")
            + " removed; a new id is created on the next run.");
      } else {
        CliPrinter.println("No client id stored under " + config.stateDir());
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to reset client id under {}", config.stateDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("State directory rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }
}
