package com.heavyai.client.log;

/**
 * Creates {@link HeavyLogger} instances.
 *
 * <p>The backend is chosen by the {@code heavydb.client.loggerImpl} system property: {@code
 * SLF4JLOGGER} (default) or {@code JDKLOGGER}.
 */
public class HeavyLoggerFactory {

  public static final String LOGGER_IMPL_PROPERTY = "heavydb.client.loggerImpl";

  enum LoggerImpl {
    SLF4JLOGGER,
    JDKLOGGER
  }

  private HeavyLoggerFactory() {}

  public static HeavyLogger getLogger(Class<?> clazz) {
    return resolveLoggerImpl() == LoggerImpl.JDKLOGGER
        ? new JulLogger(clazz)
        : new Slf4jLogger(clazz);
  }

  public static HeavyLogger getLogger(String name) {
    return resolveLoggerImpl() == LoggerImpl.JDKLOGGER
        ? new JulLogger(name)
        : new Slf4jLogger(name);
  }

  static LoggerImpl resolveLoggerImpl() {
    String value = System.getProperty(LOGGER_IMPL_PROPERTY);
    if (value == null) {
      return LoggerImpl.SLF4JLOGGER;
    }
    try {
      return LoggerImpl.valueOf(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      // Unknown values fall back to SLF4J
      return LoggerImpl.SLF4JLOGGER;
    }
  }
}
