package io.bunting.config;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.function.Supplier;

public interface Clock extends Supplier<Instant> {

  static Clock system() {
    return Instant::now;
  }

  default LocalDate todayUtc() {
    return LocalDate.ofInstant(get(), ZoneOffset.UTC);
  }
}
