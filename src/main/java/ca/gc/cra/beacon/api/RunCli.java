package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.pipeline.FeedClient;
import ca.gc.cra.beacon.config.CompositionRoot;
import ca.gc.cra.beacon.config.FeedConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the feed client until interrupted or until {@code durationSec} elapses.
 *
 * @since BEACON 0.1
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 15;
  private static final String SUMMARY_USAGE =
      "usage: run [serverUrl=ws://HOST:PORT/ws] [channels=area_type,...] [stateDir=PATH] [config=PATH] "
          + "[ackBatchSize=N] [workers=0-256] [durationSec=N] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[logLevel=LEVEL] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      BEACON feed client

      Usage:
        run [options]

      Options:
        serverUrl=URL              Feed WebSocket endpoint (default ws://localhost:2222/ws)
        channels=a_t,...           Channels to subscribe in addition to stored subscriptions
        stateDir=PATH              Persisted state directory (default ~/.beacon/state)
        config=PATH                YAML file with common/run sections; CLI values win
        workers=0-256              Ingestion workers; 0 picks 4-8 from the CPU count
        ackBatchSize=N             Acks per size-triggered flush (default 50)
        ackFlushIntervalMs=N       Periodic ack flush (default 100)
        catchUpQuietPolls=N        Quiet monitor polls before a channel goes live (default 3)
        retentionDays=N            Days stored events are kept (default 7)
        killDetectionGapMs=N       Liveness gap treated as an unclean kill (default 120000)
        durationSec=N              Stop after N seconds; 0 runs until interrupted
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        logLevel=LEVEL             Level for ca.gc.cra.beacon loggers
        --dry-run                  Print the effective configuration and exit
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private RunCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes the run command and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.settingArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      kv.put("verbose", "true");
    }
    if (!input.unrecognizedFlags().isEmpty()) {
      log.warn("Ignoring unrecognized flags {}", input.unrecognizedFlags());
    }
    if (input.dryRun()) {
      kv.put("dryRun", "true");
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig("run", kv);
      ConfigCliUtils.applyLogging(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    FeedConfig config;
    try {
      config = FeedConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return runClient(config);
  }

  private static ExitCode runClient(FeedConfig config) {
    CountDownLatch stopRequested = new CountDownLatch(1);
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      stopRequested.countDown();
      try {
        if (!stopped.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Feed client still stopping after {} s; exiting", SHUTDOWN_WAIT_SECONDS);
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }, "beacon-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try (CompositionRoot root = new CompositionRoot(config)) {
      FeedClient client = root.feedClient();
      client.start();
      log.info("Feed client running against {}", config.serverUri());
      if (config.runDuration().isZero()) {
        stopRequested.await();
      } else if (!stopRequested.await(config.runDuration().toMillis(), TimeUnit.MILLISECONDS)) {
        log.info("Run duration of {} s reached", config.runDuration().toSeconds());
      }
      log.info("Stopping; final stats {}", client.stats());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Feed client state I/O failure under {}", config.stateDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Feed client configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Feed client interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in feed client", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      stopped.countDown();
    }
  }

  private static void printDryRunPlan(FeedConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Run dry-run: no connection will be opened.");
    for (String line : config.describe().split("\\R")) {
      lines.add(" " + line);
    }
    lines.add(" Re-run without --dry-run to connect.");
    CliPrinter.printLines(lines);
  }
}
