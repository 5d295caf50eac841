// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.*;

/// Console logging for the server process. The level comes from the `LOG_LEVEL` environment variable and defaults to
/// INFO.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("INFO");
      Level level = Level.parse(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          final String loggerName = Optional.ofNullable(record.getLoggerName()).orElse("");
          final String shortName = loggerName.substring(loggerName.lastIndexOf('.') + 1);
          String line = String.format("%s [%s] %s: %s%n",
              Instant.ofEpochMilli(record.getMillis()),
              record.getLevel().getName(),
              shortName,
              formatMessage(record));
          if (record.getThrown() != null) {
            StringWriter trace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(trace));
            line += trace;
          }
          return line;
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  public static void initialize() {
    // Method to trigger static initialization which will configure the logger
  }
}
