package com.heavyai.client.log;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Formats {@code java.util.logging} records in the usual SLF4J layout, so {@link JulLogger}
 * output matches the SLF4J backend. A thrown cause is appended after the message.
 */
public class Slf4jFormatter extends Formatter {

  private static final DateTimeFormatter DATE_FORMATTER =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

  @Override
  public String format(LogRecord record) {
    String timestamp = DATE_FORMATTER.format(Instant.ofEpochMilli(record.getMillis()));
    String line =
        String.format(
            "%s %s %s#%s - %s%n",
            timestamp,
            record.getLevel().getLocalizedName(),
            record.getSourceClassName(),
            record.getSourceMethodName(),
            formatMessage(record));
    if (record.getThrown() == null) {
      return line;
    }
    StringWriter trace = new StringWriter();
    try (PrintWriter writer = new PrintWriter(trace)) {
      record.getThrown().printStackTrace(writer);
    }
    return line + trace;
  }
}
