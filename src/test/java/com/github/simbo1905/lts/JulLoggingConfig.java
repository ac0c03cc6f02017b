package com.github.simbo1905.lts;

import java.io.OutputStream;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/// Routes JUL to stdout so Maven doesn't flag FINE/FINEST output as warnings. Set
/// `-Dcom.github.simbo1905.lts.testLogLevel=FINEST` to see byte level tracing. All tests extend
/// this class to inherit the configuration.
public abstract class JulLoggingConfig {

  protected final Logger logger = Logger.getLogger(getClass().getName());

  static {
    configureJulLogging();
  }

  private static void configureJulLogging() {
    System.setProperty("java.util.logging.SimpleFormatter.format", "%1$tT %4$s %2$s %5$s%6$s%n");

    final String desiredLevel = System.getProperty("com.github.simbo1905.lts.testLogLevel", "INFO");
    Level targetLevel;
    try {
      targetLevel = Level.parse(desiredLevel.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      targetLevel = Level.INFO;
    }

    final Logger root = Logger.getLogger("");
    root.setUseParentHandlers(false);
    for (Handler handler : root.getHandlers()) {
      root.removeHandler(handler);
    }

    final Handler stdoutHandler = new StdoutHandler(System.out);
    stdoutHandler.setLevel(targetLevel);
    root.addHandler(stdoutHandler);
    root.setLevel(targetLevel);
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
