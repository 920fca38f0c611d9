package ca.gc.cra.smartconfig.application.port;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that advances one second on every read.
 */
public final class FixedClock implements ClockPort {
  private final AtomicLong millis;

  public FixedClock(long startMillis) {
    this.millis = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return millis.getAndAdd(1000L);
  }
}
