package ca.gc.cra.smartconfig.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @AfterEach
  void tearDown() {
    LoggingConfigurator.resetLogging();
  }

  @Test
  void verboseRaisesRootToDebugAndResetRestoresInfo() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());

    LoggingConfigurator.resetLogging();
    assertEquals(Level.INFO, root.getLevel());
  }
}
