package io.bunting.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SaltsTest {

  @Test
  void generatesShortLowercaseAlphanumericSalts() {
    final Set<String> salts = new HashSet<>();
    for (int i = 0; i < 1_000; i++) {
      final String salt = Salts.generate();
      assertThat(salt).matches("[a-z0-9]{13}");
      salts.add(salt);
    }
    assertThat(salts).hasSize(1_000);
  }
}
