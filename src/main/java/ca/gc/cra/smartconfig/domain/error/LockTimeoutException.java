package ca.gc.cra.smartconfig.domain.error;

import java.time.Duration;

/**
 * The store lock could not be acquired within the configured wait.
 *
 * @since 0.1.0
 */
public final class LockTimeoutException extends ConfigException {
  private final String location;
  private final Duration timeout;

  public LockTimeoutException(String location, Duration timeout) {
    super("Timed out after " + timeout.toMillis() + " ms waiting for store lock " + location);
    this.location = location;
    this.timeout = timeout;
  }

  public String location() {
    return location;
  }

  public Duration timeout() {
    return timeout;
  }
}
