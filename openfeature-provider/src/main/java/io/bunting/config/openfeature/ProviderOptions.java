package io.bunting.config.openfeature;

import static java.util.Objects.requireNonNull;

import io.bunting.config.Environment;
import java.util.Objects;

/**
 * Configuration options for {@link BuntingFeatureProvider}.
 *
 * <p>The environment selects which per-environment block of every flag is evaluated. The logging
 * level only affects console output of the provider and the evaluator underneath it.
 */
public class ProviderOptions {

  /**
   * Console logging levels for the {@code io.bunting.config} loggers. The default level is INFO,
   * which includes INFO, WARN and ERROR.
   */
  public enum LoggingLevel {
    /** All logging levels enabled, including TRACE and DEBUG messages */
    ALL,
    /** TRACE level and above */
    TRACE,
    /** DEBUG level and above */
    DEBUG,
    /** INFO level and above - this is the default */
    INFO,
    /** WARN level and above */
    WARN,
    /** ERROR level only */
    ERROR,
    /** No logging output */
    OFF
  }

  private final Environment environment;
  private final LoggingLevel loggingLevel;

  /**
   * @param environment the environment whose flag configuration is served
   * @param loggingLevel the logging level, INFO when null
   */
  public ProviderOptions(Environment environment, LoggingLevel loggingLevel) {
    this.environment = requireNonNull(environment, "environment");
    this.loggingLevel = loggingLevel != null ? loggingLevel : LoggingLevel.INFO;
  }

  /** Production at INFO. */
  public ProviderOptions() {
    this(Environment.PRODUCTION, LoggingLevel.INFO);
  }

  public Environment getEnvironment() {
    return environment;
  }

  public LoggingLevel getLoggingLevel() {
    return loggingLevel;
  }

  public static ProviderOptions forEnvironment(Environment environment) {
    return new ProviderOptions(environment, LoggingLevel.INFO);
  }

  /**
   * @throws IllegalArgumentException if {@code environment} is not a canonical environment name
   */
  public static ProviderOptions forEnvironment(String environment) {
    return forEnvironment(Environment.fromWireName(environment));
  }

  public ProviderOptions withLoggingLevel(LoggingLevel loggingLevel) {
    return new ProviderOptions(environment, loggingLevel);
  }

  public static ProviderOptions defaults() {
    return new ProviderOptions();
  }

  @Override
  public String toString() {
    return "ProviderOptions{"
        + "environment="
        + environment.wireName()
        + ", loggingLevel="
        + loggingLevel
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final ProviderOptions that = (ProviderOptions) o;
    return environment == that.environment && loggingLevel == that.loggingLevel;
  }

  @Override
  public int hashCode() {
    return Objects.hash(environment, loggingLevel);
  }
}
