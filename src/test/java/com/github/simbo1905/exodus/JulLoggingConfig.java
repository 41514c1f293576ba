package com.github.simbo1905.exodus;

import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/// Sends JUL output to stdout so Maven does not report FINE/FINEST output as warnings. netCDF-Java
/// logs through slf4j-jdk14 and so ends up here too; its loggers stay at INFO or coarser unless
/// `com.github.simbo1905.exodus.testLibraryLogLevel` asks for more.
///
/// Test classes extend this to pick up the configuration. The level for this project's loggers
/// comes from `com.github.simbo1905.exodus.testLogLevel` and defaults to INFO.
public abstract class JulLoggingConfig {

  static final String LOG_LEVEL_PROPERTY = "com.github.simbo1905.exodus.testLogLevel";
  static final String LIBRARY_LOG_LEVEL_PROPERTY =
      "com.github.simbo1905.exodus.testLibraryLogLevel";

  /// Held so the level set on it is not lost when JUL drops unreferenced loggers.
  private static final Logger LIBRARY_LOGGER = Logger.getLogger("ucar");

  protected final Logger logger = Logger.getLogger(getClass().getName());

  static {
    configure();
  }

  private static Level levelOf(String property, Level fallback) {
    final var value = System.getProperty(property, fallback.getName());
    try {
      return Level.parse(value.toUpperCase());
    } catch (IllegalArgumentException e) {
      return fallback;
    }
  }

  private static void configure() {
    System.setProperty(
        "java.util.logging.SimpleFormatter.format", "%1$tT %4$s %3$s %5$s%6$s%n");

    final var level = levelOf(LOG_LEVEL_PROPERTY, Level.INFO);

    final var root = Logger.getLogger("");
    root.setUseParentHandlers(false);
    for (Handler handler : root.getHandlers()) {
      root.removeHandler(handler);
    }
    final Handler stdout = new StdoutHandler(System.out);
    stdout.setLevel(Level.ALL);
    root.addHandler(stdout);
    root.setLevel(level);

    LIBRARY_LOGGER.setLevel(levelOf(LIBRARY_LOG_LEVEL_PROPERTY, Level.INFO));
  }

  private static final class StdoutHandler extends StreamHandler {
    StdoutHandler(OutputStream stream) {
      super(stream, new SimpleFormatter());
    }

    @Override
    public synchronized void publish(LogRecord record) {
      super.publish(record);
      flush();
    }

    @Override
    public synchronized void close() throws SecurityException {
      flush();
    }
  }
}
