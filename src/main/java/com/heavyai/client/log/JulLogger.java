package com.heavyai.client.log;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

/**
 * {@link HeavyLogger} backed by {@code java.util.logging}.
 *
 * <p>Records are printed by {@link Slf4jFormatter} so output looks the same as with the SLF4J
 * backend. The root client logger level is read from the {@code heavydb.client.logLevel} system
 * property (a {@link Level} name, default {@code INFO}).
 */
public class JulLogger implements HeavyLogger {

  static final String ROOT_LOGGER_NAME = "com.heavyai.client";
  static final String LOG_LEVEL_PROPERTY = "heavydb.client.logLevel";

  private static volatile boolean rootConfigured = false;

  private final Logger logger;

  public JulLogger(String name) {
    configureRootLogger();
    this.logger = Logger.getLogger(name);
  }

  public JulLogger(Class<?> clazz) {
    this(clazz.getName());
  }

  private static synchronized void configureRootLogger() {
    if (rootConfigured) {
      return;
    }
    Logger root = Logger.getLogger(ROOT_LOGGER_NAME);
    Level level = parseLevel(System.getProperty(LOG_LEVEL_PROPERTY));
    Handler handler = new ConsoleHandler();
    handler.setFormatter(new Slf4jFormatter());
    handler.setLevel(level);
    root.addHandler(handler);
    root.setLevel(level);
    root.setUseParentHandlers(false);
    rootConfigured = true;
  }

  static Level parseLevel(String value) {
    if (value == null || value.isBlank()) {
      return Level.INFO;
    }
    try {
      return Level.parse(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }

  @Override
  public void trace(String format, Object... arguments) {
    log(Level.FINEST, format, arguments);
  }

  @Override
  public void debug(String format, Object... arguments) {
    log(Level.FINE, format, arguments);
  }

  @Override
  public void info(String format, Object... arguments) {
    log(Level.INFO, format, arguments);
  }

  @Override
  public void warn(String format, Object... arguments) {
    log(Level.WARNING, format, arguments);
  }

  @Override
  public void error(String format, Object... arguments) {
    log(Level.SEVERE, format, arguments);
  }

  @Override
  public void error(Throwable throwable, String message) {
    if (logger.isLoggable(Level.SEVERE)) {
      publish(Level.SEVERE, message, throwable);
    }
  }

  @Override
  public boolean isDebugEnabled() {
    return logger.isLoggable(Level.FINE);
  }

  private void log(Level level, String format, Object... arguments) {
    if (!logger.isLoggable(level)) {
      return;
    }
    FormattingTuple tuple = MessageFormatter.arrayFormat(format, arguments);
    publish(level, tuple.getMessage(), tuple.getThrowable());
  }

  private void publish(Level level, String message, Throwable throwable) {
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName(logger.getName());
    record.setThrown(throwable);
    StackWalker.getInstance()
        .walk(
            frames ->
                frames
                    .filter(frame -> !frame.getClassName().equals(JulLogger.class.getName()))
                    .findFirst())
        .ifPresent(
            frame -> {
              record.setSourceClassName(frame.getClassName());
              record.setSourceMethodName(frame.getMethodName());
            });
    logger.log(record);
  }
}
