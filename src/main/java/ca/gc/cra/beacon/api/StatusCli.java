package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.CompositionRoot;
import ca.gc.cra.beacon.config.FeedConfig;
import ca.gc.cra.beacon.domain.event.Subscription;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the persisted client id, subscriptions, sync state, and stored event counts without connecting.
 *
 * @since BEACON 0.1
 */
public final class StatusCli {
  private static final Logger log = LoggerFactory.getLogger(StatusCli.class);
  private static final String SUMMARY_USAGE = "usage: status [stateDir=PATH] [config=PATH]";

  private StatusCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    FeedConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.settingArgs());
      if (input.verbose()) {
        kv.put("verbose", "true");
      }
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("status", kv);
      ConfigCliUtils.applyLogging(effective);
      config = FeedConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid status arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      CliPrinter.printLines(render(config, root.statusReport()));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read state under {}", config.stateDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("State directory rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure reading status", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> render(FeedConfig config, CompositionRoot.StatusReport report) {
    List<String> lines = new ArrayList<>();
    lines.add("State directory : " + config.stateDir());
    lines.add("Client id       : " + (report.clientId() == null ? "<none>" : report.clientId()));
    lines.add("Subscriptions   : " + report.subscriptions().size());
    for (Subscription subscription : report.subscriptions()) {
      String flags = (subscription.muted() ? " muted" : "") + (subscription.pinned() ? " pinned" : "");
      lines.add("  " + subscription.channelKey() + "  " + subscription.areaDisplay() + " - "
          + subscription.typeDisplay() + flags);
    }
    lines.add("Sync channels   : " + report.sync().channels() + " (" + report.sync().totalReceived()
        + " events received)");
    lines.add("Stored events   : " + report.storage().events() + " in " + report.storage().channels()
        + " channels, " + report.storage().unread() + " unread");
    if (report.storage().events() > 0) {
      lines.add("  oldest " + Instant.ofEpochSecond(report.storage().oldestTimestamp())
          + ", newest " + Instant.ofEpochSecond(report.storage().newestTimestamp()));
      new TreeMap<>(report.storage().perChannel())
          .forEach((channel, count) -> lines.add("  " + channel + ": " + count));
    }
    return lines;
  }
}
