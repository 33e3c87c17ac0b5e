package io.bunting.config.signing;

import io.bunting.config.Clock;
import java.time.Duration;
import java.time.Instant;

public class FakeClock implements Clock {
  private Instant now;

  public FakeClock(Instant now) {
    this.now = now;
  }

  @Override
  public Instant get() {
    return now;
  }

  public void setNow(Instant now) {
    this.now = now;
  }

  public void advance(Duration duration) {
    this.now = now.plus(duration);
  }
}
