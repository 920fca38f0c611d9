package ca.gc.cra.smartconfig.infrastructure.time;

import ca.gc.cra.smartconfig.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
