package ca.gc.cra.beacon.api;

/**
 * <strong>What:</strong> Process exit codes shared by the BEACON commands.
 * <p><strong>Why:</strong> Lets scripts and service managers tell bad input apart from storage or runtime
 * failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since BEACON 0.1
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or were out of range. */
  INVALID_ARGS(2),
  /** The state directory could not be read or written. */
  IO_ERROR(3),
  /** The YAML file or merged configuration was rejected. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted while waiting for shutdown. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status passed to {@link System#exit(int)}
   */
  public int code() {
    return code;
  }
}
