package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.application.port.FixedClock;
import ca.gc.cra.smartconfig.config.CompositionRoot;
import ca.gc.cra.smartconfig.logging.LoggingConfigurator;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Captures stdout and smartconfig log events for CLI tests and wires a composition root with a fixed
 * environment and clock.
 */
final class CliHarness {
  static final long START_MILLIS = 1_700_000_000_000L;

  final Map<String, String> env = new HashMap<>();
  private final StringWriter buffer = new StringWriter();
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final Logger logger = (Logger) LoggerFactory.getLogger("ca.gc.cra.smartconfig");
  private boolean originalAdditive;

  void start() {
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    FixedClock clock = new FixedClock(START_MILLIS);
    CliSupport.setRootFactoryForTesting(settings -> new CompositionRoot(settings, env::get, clock));
  }

  void stop() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
    CliSupport.clearRootFactory();
    LoggingConfigurator.resetLogging();
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
  }

  ExitCode run(String... args) {
    return Main.run(args);
  }

  String output() {
    return buffer.toString();
  }

  void clearOutput() {
    buffer.getBuffer().setLength(0);
  }

  boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }

  boolean anyLogContains(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
