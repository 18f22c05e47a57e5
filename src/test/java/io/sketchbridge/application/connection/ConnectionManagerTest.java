package io.sketchbridge.application.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.application.port.ConnectionListener;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.PlaneInfo;
import io.sketchbridge.domain.cad.SketchInfo;
import io.sketchbridge.domain.sketch.SketchDocument;
import io.sketchbridge.testutil.FakeCadClient;
import io.sketchbridge.testutil.FakeClients;
import io.sketchbridge.testutil.RecordingConnectionListener;
import io.sketchbridge.testutil.RecordingConnectionListener.Change;
import io.sketchbridge.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ConnectionManagerTest {
  private static final Logger MANAGER_LOGGER = (Logger) LoggerFactory.getLogger(ConnectionManager.class);
  private static final Duration PROBE_TIMEOUT = Duration.ofMillis(250);
  private static Level originalLevel;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingConnectionListener listener = new RecordingConnectionListener();
  private ConnectionManager manager;

  @BeforeAll
  static void quietManagerLogs() {
    originalLevel = MANAGER_LOGGER.getLevel();
    MANAGER_LOGGER.setLevel(Level.ERROR);
  }

  @AfterAll
  static void restoreManagerLogs() {
    MANAGER_LOGGER.setLevel(originalLevel);
  }

  @AfterEach
  void tearDown() {
    if (manager != null) {
      manager.close();
    }
  }

  @Test
  void failedConnectLeavesBackendDisconnectedWithEmptyStatus() {
    FakeClients clients = FakeClients.allUnreachable();
    manager = newManager(clients, LivenessPolicy.TRUST_CACHED);

    assertFalse(manager.connect(Backend.FREECAD));

    assertFalse(manager.isConnected(Backend.FREECAD));
    assertTrue(manager.status(Backend.FREECAD).isEmpty());
    assertEquals(List.of(new Change(Backend.FREECAD, false)), listener.changes());
    assertEquals(List.of(ConnectionManager.DEFAULT_CONNECT_TIMEOUT), clients.get(Backend.FREECAD).connectTimeouts);
  }

  @Test
  void throwingConnectIsContained() {
    FakeCadClient freecad = new FakeCadClient();
    freecad.connectFailure = new IllegalStateException("socket refused");
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad), LivenessPolicy.TRUST_CACHED);

    assertFalse(manager.connect(Backend.FREECAD, Duration.ofSeconds(2)));
    assertFalse(manager.isConnected(Backend.FREECAD));
    assertTrue(manager.status(Backend.FREECAD).isEmpty());
  }

  @Test
  void successfulConnectCachesStatusAndNotifies() {
    FakeCadClient fusion = new FakeCadClient();
    fusion.status = Map.of("active_document", "Bracket", "sketch_count", 3);
    manager = newManager(FakeClients.allUnreachable().with(Backend.FUSION, fusion), LivenessPolicy.TRUST_CACHED);

    assertTrue(manager.connect(Backend.FUSION, Duration.ofSeconds(2)));

    assertTrue(manager.isConnected(Backend.FUSION));
    assertEquals("Bracket", manager.status(Backend.FUSION).get("active_document"));
    assertEquals(List.of(new Change(Backend.FUSION, true)), listener.changes());
    assertEquals(1, listener.statuses().size());
    assertEquals(List.of(Duration.ofSeconds(2)), fusion.connectTimeouts);
  }

  @Test
  void manualConnectNotifiesEvenWithoutChange() {
    manager = newManager(
        FakeClients.allUnreachable().with(Backend.INVENTOR, new FakeCadClient()), LivenessPolicy.TRUST_CACHED);

    manager.connect(Backend.INVENTOR);
    manager.connect(Backend.INVENTOR);

    assertEquals(2, listener.changesFor(Backend.INVENTOR).size());
  }

  @Test
  void probeNotificationsAreEdgeTriggered() {
    FakeCadClient freecad = new FakeCadClient();
    freecad.status = Map.of("active_document", "Part");
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad), LivenessPolicy.TRUST_CACHED);

    assertTrue(manager.probeNow());
    assertTrue(manager.probeNow());
    assertTrue(manager.probeNow());

    assertEquals(List.of(new Change(Backend.FREECAD, true)), listener.changes());
    assertEquals(3, listener.statuses().size());
    assertEquals(1, metrics.count("connection.changed"));
    assertEquals(3, metrics.count("probe.cycle.started"));
    assertEquals(3, metrics.observations("probe.cycle.latencyNanos").size());
    assertFalse(manager.isCycleInProgress());
  }

  @Test
  void trustCachedOnlyAsksForStatusOnceConnected() {
    FakeCadClient freecad = new FakeCadClient();
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad), LivenessPolicy.TRUST_CACHED);

    manager.probeNow();
    manager.probeNow();
    freecad.dropSession();
    manager.probeNow();

    assertEquals(1, freecad.connectCalls.get());
    assertEquals(3, freecad.statusCalls.get());
    assertEquals(0, freecad.isConnectedCalls.get());
    assertEquals(List.of(PROBE_TIMEOUT), freecad.connectTimeouts);
    assertTrue(manager.isConnected(Backend.FREECAD));
  }

  @Test
  void failingStatusMarksBackendDisconnected() {
    FakeCadClient freecad = new FakeCadClient();
    freecad.status = Map.of("active_document", "Part");
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad), LivenessPolicy.TRUST_CACHED);

    manager.probeNow();
    freecad.statusFailure = new IllegalStateException("rpc timeout");
    manager.probeNow();
    manager.probeNow();

    assertFalse(manager.isConnected(Backend.FREECAD));
    assertTrue(manager.status(Backend.FREECAD).isEmpty());
    assertEquals(
        List.of(new Change(Backend.FREECAD, true), new Change(Backend.FREECAD, false)), listener.changes());
    assertEquals(2, metrics.count("probe.connect.failed"));
  }

  @Test
  void revalidateReconnectsWhenSessionDropped() {
    FakeCadClient solidworks = new FakeCadClient();
    manager = newManager(
        FakeClients.allUnreachable().with(Backend.SOLIDWORKS, solidworks), LivenessPolicy.REVALIDATE);

    manager.probeNow();
    manager.probeNow();
    assertEquals(1, solidworks.connectCalls.get());

    solidworks.dropSession();
    manager.probeNow();

    assertEquals(2, solidworks.connectCalls.get());
    assertEquals(3, solidworks.isConnectedCalls.get());
    assertEquals(List.of(new Change(Backend.SOLIDWORKS, true)), listener.changesFor(Backend.SOLIDWORKS));
  }

  @Test
  void revalidateDetectsBackendThatWentAway() {
    FakeCadClient solidworks = new FakeCadClient();
    manager = newManager(
        FakeClients.allUnreachable().with(Backend.SOLIDWORKS, solidworks), LivenessPolicy.REVALIDATE);

    manager.probeNow();
    solidworks.dropSession();
    solidworks.connectResult = false;
    manager.probeNow();

    assertFalse(manager.isConnected(Backend.SOLIDWORKS));
    assertEquals(
        List.of(new Change(Backend.SOLIDWORKS, true), new Change(Backend.SOLIDWORKS, false)),
        listener.changesFor(Backend.SOLIDWORKS));
  }

  @Test
  void disconnectFailureStillMarksBackendDisconnected() {
    FakeCadClient inventor = new FakeCadClient();
    inventor.disconnectFailure = new IllegalStateException("already closed");
    manager = newManager(FakeClients.allUnreachable().with(Backend.INVENTOR, inventor), LivenessPolicy.TRUST_CACHED);
    manager.connect(Backend.INVENTOR);
    listener.clear();

    manager.disconnect(Backend.INVENTOR);

    assertFalse(manager.isConnected(Backend.INVENTOR));
    assertEquals(List.of(new Change(Backend.INVENTOR, false)), listener.changes());
    assertEquals(1, inventor.disconnectCalls.get());
  }

  @Test
  void operationsOnDisconnectedBackendReturnEmptyWithoutAdapterCalls() {
    FakeCadClient freecad = new FakeCadClient();
    freecad.sketches = List.of(new SketchInfo("Sketch", "Sketch", 1, 0));
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad), LivenessPolicy.TRUST_CACHED);

    assertTrue(manager.listSketches(Backend.FREECAD).isEmpty());
    assertTrue(manager.listPlanes(Backend.FREECAD).isEmpty());
    assertTrue(manager.exportSketch(Backend.FREECAD, "Sketch").isEmpty());
    assertTrue(manager.importSketch(Backend.FREECAD, new SketchDocument("S"), null, "XY").isEmpty());
    assertTrue(freecad.exportRequests.isEmpty());
    assertTrue(freecad.imported.isEmpty());
  }

  @Test
  void connectedOperationsDelegateToAdapter() {
    FakeCadClient freecad = new FakeCadClient();
    freecad.sketches = List.of(new SketchInfo("Sketch", "Profile", 4, 2));
    freecad.planes = List.of(new PlaneInfo("P1", "Top", "origin"));
    freecad.withExport(new SketchDocument("Sketch"));
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad), LivenessPolicy.TRUST_CACHED);
    manager.connect(Backend.FREECAD);

    assertEquals(freecad.sketches, manager.listSketches(Backend.FREECAD));
    assertEquals(freecad.planes, manager.listPlanes(Backend.FREECAD));
    assertEquals("Sketch", manager.exportSketch(Backend.FREECAD, "Sketch").orElseThrow().name());
    assertTrue(manager.exportSketch(Backend.FREECAD, "Missing").isEmpty());
  }

  @Test
  void failedImportNeverOpens() {
    FakeCadClient fusion = new FakeCadClient();
    fusion.importFailure = new IllegalStateException("bad plane");
    manager = newManager(FakeClients.allUnreachable().with(Backend.FUSION, fusion), LivenessPolicy.TRUST_CACHED);
    manager.connect(Backend.FUSION);

    assertTrue(manager.importSketch(Backend.FUSION, new SketchDocument("S"), "Copy", "XY").isEmpty());
    assertEquals(0, fusion.openCalls.get());
  }

  @Test
  void blankImportNameCountsAsFailure() {
    FakeCadClient fusion = new FakeCadClient();
    fusion.importResult = " ";
    manager = newManager(FakeClients.allUnreachable().with(Backend.FUSION, fusion), LivenessPolicy.TRUST_CACHED);
    manager.connect(Backend.FUSION);

    assertTrue(manager.importSketch(Backend.FUSION, new SketchDocument("S"), null, null).isEmpty());
    assertEquals(0, fusion.openCalls.get());
  }

  @Test
  void failedOpenStillReportsImportedName() {
    FakeCadClient fusion = new FakeCadClient();
    fusion.importResult = "Sketch7";
    fusion.openFailure = new IllegalStateException("no window");
    manager = newManager(FakeClients.allUnreachable().with(Backend.FUSION, fusion), LivenessPolicy.TRUST_CACHED);
    manager.connect(Backend.FUSION);

    assertEquals("Sketch7", manager.importSketch(Backend.FUSION, new SketchDocument("S"), "Copy", "XY").orElseThrow());
    assertEquals(1, fusion.openCalls.get());
    assertEquals(List.of("Copy"), fusion.importedNames);
    assertEquals(List.of("XY"), fusion.importedPlanes);
  }

  @Test
  void throwingListenerDoesNotStarveOthers() {
    manager = newManager(
        FakeClients.allUnreachable().with(Backend.FREECAD, new FakeCadClient()), LivenessPolicy.TRUST_CACHED);
    manager.removeListener(listener);
    manager.addListener(new ConnectionListener() {
      @Override
      public void connectivityChanged(Backend backend, boolean connected) {
        throw new IllegalStateException("listener bug");
      }
    });
    manager.addListener(listener);

    manager.probeNow();

    assertEquals(List.of(new Change(Backend.FREECAD, true)), listener.changes());
    assertTrue(manager.isConnected(Backend.FREECAD));
  }

  @Test
  void removedListenerStopsReceivingEvents() {
    manager = newManager(
        FakeClients.allUnreachable().with(Backend.FREECAD, new FakeCadClient()), LivenessPolicy.TRUST_CACHED);
    manager.removeListener(listener);

    manager.probeNow();

    assertTrue(listener.changes().isEmpty());
  }

  @Test
  void lifecycleRejectsRestart() {
    manager = newManager(FakeClients.allUnreachable(), LivenessPolicy.TRUST_CACHED);
    manager.start(Duration.ofHours(1));

    assertThrows(IllegalStateException.class, () -> manager.start(Duration.ofHours(1)));
    manager.stop();
    manager.stop();
    assertThrows(IllegalStateException.class, manager::start);
  }

  @Test
  void startRejectsNonPositiveInterval() {
    manager = newManager(FakeClients.allUnreachable(), LivenessPolicy.TRUST_CACHED);
    assertThrows(IllegalArgumentException.class, () -> manager.start(Duration.ZERO));
  }

  @Test
  void scheduledTicksDiscoverBackend() throws Exception {
    FakeCadClient fusion = new FakeCadClient();
    manager = newManager(FakeClients.allUnreachable().with(Backend.FUSION, fusion), LivenessPolicy.TRUST_CACHED);

    manager.start(Duration.ofMillis(20));

    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!manager.isConnected(Backend.FUSION) && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(manager.isConnected(Backend.FUSION));
    assertEquals(List.of(new Change(Backend.FUSION, true)), listener.changesFor(Backend.FUSION));
  }

  @Test
  void requiresClientForEveryBackend() {
    Map<Backend, CadClientPort> partial = Map.of(Backend.FREECAD, new FakeCadClient());
    assertThrows(NullPointerException.class,
        () -> new ConnectionManager(partial, new InlineProbeStrategy(), ProbeSettings.defaults(), metrics));
  }

  @Test
  void exposesBackendsAndDisplayNames() {
    assertEquals(Backend.all(), ConnectionManager.backends());
    assertEquals("SolidWorks", ConnectionManager.displayName(Backend.SOLIDWORKS));
  }

  @Test
  void slowListenerDoesNotBlockReadsOrOtherWriters() throws Exception {
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, new FakeCadClient()),
        LivenessPolicy.TRUST_CACHED);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean first = new AtomicBoolean(true);
    manager.addListener(new ConnectionListener() {
      @Override
      public void connectivityChanged(Backend backend, boolean connected) {
        if (first.compareAndSet(true, false)) {
          entered.countDown();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        }
      }
    });

    Thread connecting = new Thread(() -> manager.connect(Backend.FREECAD), "test-connect");
    connecting.start();
    try {
      assertTrue(entered.await(2, TimeUnit.SECONDS));
      assertTrue(manager.isConnected(Backend.FREECAD));

      Thread disconnecting = new Thread(() -> manager.disconnect(Backend.FREECAD), "test-disconnect");
      disconnecting.start();
      disconnecting.join(2_000);
      assertFalse(disconnecting.isAlive(), "disconnect waited behind a blocked listener");
      assertFalse(manager.isConnected(Backend.FREECAD));
    } finally {
      release.countDown();
      connecting.join(2_000);
    }
  }

  private ConnectionManager newManager(FakeClients clients, LivenessPolicy policy) {
    ProbeSettings settings =
        new ProbeSettings(Duration.ofSeconds(5), PROBE_TIMEOUT, Duration.ofMillis(10), policy);
    ConnectionManager created =
        new ConnectionManager(clients.asPorts(), new InlineProbeStrategy(), settings, metrics);
    created.addListener(listener);
    return created;
  }
}
