package ca.gc.cra.smartconfig.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by smartconfig commands.
 * <p><strong>Why:</strong> Gives schedulers, notifiers and sync jobs that drive the CLI a stable status to react
 * to.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** A configuration document, schema or the history log was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The configuration violates its schema. */
  VALIDATION_FAILED(6),
  /** Vault key missing or wrong, or a ciphertext failed authentication. */
  SECURITY_ERROR(7),
  /** The history lock could not be acquired in time. */
  LOCK_TIMEOUT(8),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
