package io.bunting.config.signing;

import io.bunting.config.Clock;
import java.time.Instant;

/** Key generation is slow, so tests share a few pairs. */
final class TestKeys {

  static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");

  static final SigningKey FIRST = SigningKeys.generate(fixed(CREATED)).withActive(true);
  static final SigningKey SECOND =
      SigningKeys.generate(fixed(CREATED.plusSeconds(60))).withActive(true);

  private TestKeys() {}

  static Clock fixed(Instant instant) {
    return () -> instant;
  }
}
