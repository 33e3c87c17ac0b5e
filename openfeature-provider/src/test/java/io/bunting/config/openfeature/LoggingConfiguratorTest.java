package io.bunting.config.openfeature;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.bunting.config.Environment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  private final Logger engineLogger =
      (Logger) LoggerFactory.getLogger(LoggingConfigurator.ROOT_PACKAGE);
  private final Level originalLevel = engineLogger.getLevel();

  @AfterEach
  void restoreLevel() {
    engineLogger.setLevel(originalLevel);
  }

  private static ProviderOptions at(ProviderOptions.LoggingLevel level) {
    return ProviderOptions.defaults().withLoggingLevel(level);
  }

  @Test
  void nullOptionsAreIgnored() {
    assertThatCode(() -> LoggingConfigurator.configureLogging(null)).doesNotThrowAnyException();
    assertThatCode(() -> LoggingConfigurator.configureLogger("test.logger", null))
        .doesNotThrowAnyException();
    assertThat(engineLogger.getLevel()).isEqualTo(originalLevel);
  }

  @Test
  void nullLoggerNameIsIgnored() {
    assertThatCode(
            () -> LoggingConfigurator.configureLogger(null, at(ProviderOptions.LoggingLevel.WARN)))
        .doesNotThrowAnyException();
  }

  @Test
  void logbackIsDetectedOnTheTestClasspath() {
    assertThat(LoggingConfigurator.isLogbackAvailable()).isTrue();
  }

  @Test
  void engineLoggerLevelFollowsTheOptions() {
    LoggingConfigurator.configureLogging(at(ProviderOptions.LoggingLevel.ERROR));

    assertThat(engineLogger.getLevel()).isEqualTo(Level.ERROR);
    assertThat(LoggerFactory.getLogger("io.bunting.config.evaluation").isWarnEnabled()).isFalse();
  }

  @Test
  void everyLevelMapsOntoLogback() {
    for (ProviderOptions.LoggingLevel level : ProviderOptions.LoggingLevel.values()) {
      LoggingConfigurator.configureLogging(at(level));

      assertThat(engineLogger.getLevel()).isEqualTo(Level.toLevel(level.name()));
    }
  }

  @Test
  void specificLoggerCanBeConfigured() {
    final Logger other = (Logger) LoggerFactory.getLogger("test.logger");

    LoggingConfigurator.configureLogger("test.logger", at(ProviderOptions.LoggingLevel.WARN));

    assertThat(other.getLevel()).isEqualTo(Level.WARN);
    other.setLevel(null);
  }

  @Test
  void providerAppliesItsOptionsOnConstruction() {
    new BuntingFeatureProvider(
        new ProviderOptions(Environment.STAGING, ProviderOptions.LoggingLevel.OFF));

    assertThat(engineLogger.getLevel()).isEqualTo(Level.OFF);
  }
}
