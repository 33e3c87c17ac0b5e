package io.bunting.config.openfeature;

import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link ProviderOptions.LoggingLevel} to the engine's loggers.
 *
 * <p>Logback is driven reflectively so it stays an optional runtime dependency. With any other
 * SLF4J binding the level is left to that binding's own configuration.
 */
class LoggingConfigurator {

  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  static final String ROOT_PACKAGE = "io.bunting.config";

  private static Class<?> logbackLevelClass = null;
  private static Class<?> logbackLoggerClass = null;
  private static Method setLevelMethod = null;
  private static boolean logbackAvailable = false;

  static {
    initializeLogbackSupport();
  }

  private LoggingConfigurator() {}

  static void configureLogging(ProviderOptions options) {
    if (options == null) {
      return;
    }
    configureLogger(ROOT_PACKAGE, options);
  }

  static void configureLogger(String loggerName, ProviderOptions options) {
    if (options == null || loggerName == null || !logbackAvailable) {
      return;
    }
    final Logger slf4jLogger = LoggerFactory.getLogger(loggerName);
    if (!logbackLoggerClass.isInstance(slf4jLogger)) {
      return;
    }
    try {
      setLevelMethod.invoke(slf4jLogger, toLogbackLevel(options.getLoggingLevel()));
    } catch (ReflectiveOperationException e) {
      log.debug("Could not set level of logger {}", loggerName, e);
    }
  }

  static boolean isLogbackAvailable() {
    return logbackAvailable;
  }

  private static void initializeLogbackSupport() {
    try {
      logbackLevelClass = Class.forName("ch.qos.logback.classic.Level");
      logbackLoggerClass = Class.forName("ch.qos.logback.classic.Logger");
      setLevelMethod = logbackLoggerClass.getMethod("setLevel", logbackLevelClass);
      logbackAvailable = true;
    } catch (ClassNotFoundException | NoSuchMethodException e) {
      log.debug("Logback not on the classpath, provider logging level is not applied");
      logbackAvailable = false;
    }
  }

  // Logback's Level constants share the enum's names
  private static Object toLogbackLevel(ProviderOptions.LoggingLevel loggingLevel)
      throws ReflectiveOperationException {
    return logbackLevelClass.getField(loggingLevel.name()).get(null);
  }
}
