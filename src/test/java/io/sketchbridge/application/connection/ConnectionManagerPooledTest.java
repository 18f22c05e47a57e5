package io.sketchbridge.application.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.testutil.FakeCadClient;
import io.sketchbridge.testutil.FakeClients;
import io.sketchbridge.testutil.RecordingConnectionListener;
import io.sketchbridge.testutil.RecordingConnectionListener.Change;
import io.sketchbridge.testutil.RecordingMetrics;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerPooledTest {
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingConnectionListener listener = new RecordingConnectionListener();
  private ConnectionManager manager;

  @AfterEach
  void tearDown() {
    if (manager != null) {
      manager.close();
    }
  }

  @Test
  void overlappingCycleIsSkippedWhileProbeBlocks() throws Exception {
    FakeCadClient freecad = new FakeCadClient();
    CountDownLatch gate = new CountDownLatch(1);
    freecad.connectGate = gate;
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad));

    assertTrue(manager.probeNow());
    assertTrue(freecad.connectEntered.await(5, TimeUnit.SECONDS), "probe never reached the adapter");
    assertTrue(manager.isCycleInProgress());

    assertFalse(manager.probeNow());
    assertFalse(manager.probeNow());

    assertEquals(1, freecad.connectCalls.get());
    assertEquals(2, metrics.count("probe.cycle.skipped"));
    assertEquals(1, metrics.count("probe.cycle.started"));

    gate.countDown();
    awaitTrue(() -> !manager.isCycleInProgress() && manager.isConnected(Backend.FREECAD));

    assertEquals(List.of(new Change(Backend.FREECAD, true)), listener.changesFor(Backend.FREECAD));
    assertTrue(manager.probeNow());
  }

  @Test
  void slowBackendDoesNotDelayOthers() throws Exception {
    FakeCadClient freecad = new FakeCadClient();
    freecad.connectGate = new CountDownLatch(1);
    FakeCadClient fusion = new FakeCadClient();
    fusion.status = Map.of("active_document", "Hinge");
    manager = newManager(
        FakeClients.allUnreachable().with(Backend.FREECAD, freecad).with(Backend.FUSION, fusion));

    manager.probeNow();

    awaitTrue(() -> manager.isConnected(Backend.FUSION));
    assertFalse(manager.isConnected(Backend.FREECAD));
    assertTrue(manager.isCycleInProgress());
    assertEquals("Hinge", manager.status(Backend.FUSION).get("active_document"));

    freecad.connectGate.countDown();
    awaitTrue(() -> !manager.isCycleInProgress());
    assertEquals(1, metrics.observations("probe.cycle.latencyNanos").size());
  }

  @Test
  void stopAbandonsInFlightCycle() throws Exception {
    FakeCadClient freecad = new FakeCadClient();
    CountDownLatch gate = new CountDownLatch(1);
    freecad.connectGate = gate;
    manager = newManager(FakeClients.allUnreachable().with(Backend.FREECAD, freecad));

    manager.probeNow();
    assertTrue(freecad.connectEntered.await(5, TimeUnit.SECONDS));
    manager.stop();
    gate.countDown();

    awaitTrue(() -> !manager.isCycleInProgress());
    assertFalse(manager.isConnected(Backend.FREECAD));
  }

  private ConnectionManager newManager(FakeClients clients) {
    ProbeSettings settings = new ProbeSettings(
        Duration.ofSeconds(5), Duration.ofMillis(250), Duration.ofMillis(10), LivenessPolicy.TRUST_CACHED);
    ConnectionManager created =
        new ConnectionManager(clients.asPorts(), new PooledProbeStrategy(4), settings, metrics);
    created.addListener(listener);
    return created;
  }

  private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 5s");
      }
      Thread.sleep(10);
    }
  }
}
