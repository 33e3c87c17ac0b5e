package io.bunting.config.publish;

import io.bunting.config.Clock;
import java.time.Duration;
import java.time.Instant;

class FakeClock implements Clock {
  private volatile Instant now;

  FakeClock(Instant now) {
    this.now = now;
  }

  @Override
  public Instant get() {
    return now;
  }

  void advance(Duration duration) {
    this.now = now.plus(duration);
  }
}
