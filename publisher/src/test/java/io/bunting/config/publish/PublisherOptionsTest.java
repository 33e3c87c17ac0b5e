package io.bunting.config.publish;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PublisherOptionsTest {

  @Test
  void defaults() {
    final PublisherOptions options = PublisherOptions.defaults();

    assertThat(options.getSignatureTtl()).isEqualTo(Duration.ofHours(24));
    assertThat(options.getMaxArtifactBytes()).isEqualTo(1_048_576);
    assertThat(options.getMaxVersionAttempts()).isEqualTo(5);
    assertThat(options).isEqualTo(PublisherOptions.builder().build());
  }

  @Test
  void environmentOverridesDefaults() {
    final Map<String, String> environment =
        Map.of("BUNTING_SIGNATURE_TTL_HOURS", "48", "BUNTING_MAX_CONFIG_BYTES", " 2048 ");

    final PublisherOptions options = PublisherOptions.fromEnvironment(environment::get);

    assertThat(options.getSignatureTtl()).isEqualTo(Duration.ofHours(48));
    assertThat(options.getMaxArtifactBytes()).isEqualTo(2048);
  }

  @Test
  void unsetVariablesKeepDefaults() {
    assertThat(PublisherOptions.fromEnvironment(name -> null))
        .isEqualTo(PublisherOptions.defaults());
  }

  @Test
  void rejectsMalformedEnvironmentValues() {
    assertThatThrownBy(
            () ->
                PublisherOptions.fromEnvironment(
                    Map.of("BUNTING_MAX_CONFIG_BYTES", "lots")::get))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("BUNTING_MAX_CONFIG_BYTES must be an integer");
    assertThatThrownBy(
            () ->
                PublisherOptions.fromEnvironment(
                    Map.of("BUNTING_SIGNATURE_TTL_HOURS", "0")::get))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be positive");
  }

  @Test
  void builderRejectsNonPositiveValues() {
    assertThatThrownBy(() -> PublisherOptions.builder().maxVersionAttempts(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PublisherOptions.builder().signatureTtl(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
