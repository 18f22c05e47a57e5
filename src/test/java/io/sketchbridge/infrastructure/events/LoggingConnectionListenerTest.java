package io.sketchbridge.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConnectionListenerTest {

  @Test
  void connectivityChangesAreLoggedAndCounted() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingConnectionListener listener = new LoggingConnectionListener(metrics, "testConnections");

    List<ILoggingEvent> events = capture(() -> {
      listener.connectivityChanged(Backend.SOLIDWORKS, true);
      listener.connectivityChanged(Backend.SOLIDWORKS, false);
    });

    assertEquals(1L, metrics.count("testConnections.connected"));
    assertEquals(1L, metrics.count("testConnections.disconnected"));
    assertEquals(2, events.size());
    assertEquals(Level.INFO, events.get(0).getLevel());
    assertEquals("connection.event backend=solidworks connected=true", events.get(0).getFormattedMessage());
  }

  @Test
  void statusUpdatesAreSummarizedAtDebug() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingConnectionListener listener = new LoggingConnectionListener(metrics);

    List<ILoggingEvent> events = capture(
        () -> listener.statusUpdated(Backend.FREECAD, Map.of("active_document", "Gear\nBox")));

    assertEquals(1L, metrics.count("connection.events.status"));
    assertEquals(1, events.size());
    assertEquals(Level.DEBUG, events.get(0).getLevel());
    assertEquals("connection.status backend=freecad status={active_document=Gear Box}",
        events.get(0).getFormattedMessage());
  }

  @Test
  void rejectsNullBackend() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingConnectionListener listener = new LoggingConnectionListener(metrics);

    assertThrows(NullPointerException.class, () -> listener.connectivityChanged(null, true));
    assertEquals(0L, metrics.count("connection.events.connected"));
  }

  private static List<ILoggingEvent> capture(Runnable action) {
    Logger logger = (Logger) LoggerFactory.getLogger(LoggingConnectionListener.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    Level originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);
    try {
      action.run();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }
    return appender.list;
  }
}
