package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.domain.event.ChannelCatalog;
import ca.gc.cra.beacon.domain.event.Subscription;
import ca.gc.cra.beacon.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the channel keys in the catalog, optionally for one area.
 */
public final class ChannelsCli {
  private static final Logger log = LoggerFactory.getLogger(ChannelsCli.class);
  private static final String SUMMARY_USAGE = "usage: channels [area=NAME]";

  private ChannelsCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    String area;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.settingArgs());
      String raw = kv.getOrDefault("area", "");
      area = raw.isBlank() ? "" : Strings.requireChannelToken("area", raw);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid channels arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!area.isEmpty() && !ChannelCatalog.areas().containsKey(area)) {
      log.error("Unknown area '{}'; known areas: {}", area, String.join(", ", ChannelCatalog.areas().keySet()));
      return ExitCode.INVALID_ARGS;
    }
    CliPrinter.printLines(render(area));
    return ExitCode.SUCCESS;
  }

  static List<String> render(String area) {
    List<String> lines = new ArrayList<>();
    for (Subscription channel : ChannelCatalog.allChannels()) {
      if (area.isEmpty() || channel.channel().area().equals(area)) {
        lines.add(String.format("%-24s %s - %s", channel.channelKey(), channel.areaDisplay(), channel.typeDisplay()));
      }
    }
    return lines;
  }
}
