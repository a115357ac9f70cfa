package com.heavyai.client.log;

/**
 * Logging facade used throughout the client.
 *
 * <p>Messages use SLF4J style {@code {}} placeholders. When the last argument is a {@link
 * Throwable} that is not consumed by a placeholder, it is logged as the cause.
 */
public interface HeavyLogger {

  void trace(String format, Object... arguments);

  void debug(String format, Object... arguments);

  void info(String format, Object... arguments);

  void warn(String format, Object... arguments);

  void error(String format, Object... arguments);

  /**
   * Logs an error with an explicit cause.
   *
   * @param throwable the cause
   * @param message the message, logged verbatim
   */
  void error(Throwable throwable, String message);

  boolean isDebugEnabled();
}
