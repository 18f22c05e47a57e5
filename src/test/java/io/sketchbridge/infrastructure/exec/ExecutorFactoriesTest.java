package io.sketchbridge.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void probePoolUsesNamedDaemonThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newProbePool(2, "probe-test", null);
    try {
      Thread worker = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertTrue(worker.getName().startsWith("probe-test-"));
      assertTrue(worker.isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void probePoolRejectsAfterShutdown() {
    ExecutorService pool = ExecutorFactories.newProbePool(1, "probe-test", null);
    pool.shutdown();
    assertThrows(RejectedExecutionException.class, () -> pool.submit(() -> { }));
  }

  @Test
  void probePoolRequiresPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newProbePool(0, "x", null));
  }

  @Test
  void controlSchedulerRunsOnSingleNamedThread() throws Exception {
    ScheduledExecutorService control = ExecutorFactories.newControlScheduler("control-test");
    try {
      Thread first = control.schedule(Thread::currentThread, 1, TimeUnit.MILLISECONDS).get(5, TimeUnit.SECONDS);
      Thread second = control.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertEquals("control-test", first.getName());
      assertEquals(first, second);
      assertTrue(first.isDaemon());
    } finally {
      control.shutdownNow();
    }
  }
}
