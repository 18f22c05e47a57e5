package io.sketchbridge.application.connection;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.infrastructure.exec.ExecutorFactories;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs probes concurrently on a bounded worker pool so the control thread never blocks on network I/O.
 *
 * <p>Worker threads are named {@code sketchbridge-probe-N}. {@link #shutdown()} stops intake but leaves running
 * probes to finish against their own timeouts.</p>
 *
 * @since 0.1.0
 */
public final class PooledProbeStrategy implements ProbeStrategy {
  private static final Logger log = LoggerFactory.getLogger(PooledProbeStrategy.class);

  /** Default worker count; one per supported backend. */
  public static final int DEFAULT_WORKERS = 4;

  private final ExecutorService executor;

  /** Creates a strategy with {@link #DEFAULT_WORKERS} workers. */
  public PooledProbeStrategy() {
    this(DEFAULT_WORKERS);
  }

  /**
   * Creates a strategy with a dedicated pool.
   *
   * @param workers number of probe threads; must be positive
   */
  public PooledProbeStrategy(int workers) {
    this(ExecutorFactories.newProbePool(workers, "sketchbridge-probe", null));
  }

  /**
   * Creates a strategy over an existing executor, which the strategy then owns.
   *
   * @param executor executor running probe tasks
   */
  public PooledProbeStrategy(ExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public ProbeRound dispatch(Map<Backend, Callable<ProbeResult>> probes) {
    Map<Backend, Future<ProbeResult>> futures = new EnumMap<>(Backend.class);
    for (Map.Entry<Backend, Callable<ProbeResult>> entry : probes.entrySet()) {
      try {
        futures.put(entry.getKey(), executor.submit(entry.getValue()));
      } catch (RejectedExecutionException ex) {
        log.debug("Probe pool rejected {}; skipping it this cycle", entry.getKey().displayName());
      }
    }
    return new FutureRound(futures);
  }

  @Override
  public void shutdown() {
    executor.shutdown();
  }

  @Override
  public String name() {
    return "pooled";
  }

  private static final class FutureRound implements ProbeRound {
    private final Map<Backend, Future<ProbeResult>> pending;

    FutureRound(Map<Backend, Future<ProbeResult>> pending) {
      this.pending = pending;
    }

    @Override
    public synchronized Map<Backend, ProbeResult> drainCompleted() {
      Map<Backend, ProbeResult> drained = new EnumMap<>(Backend.class);
      Iterator<Map.Entry<Backend, Future<ProbeResult>>> it = pending.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<Backend, Future<ProbeResult>> entry = it.next();
        if (entry.getValue().isDone()) {
          drained.put(entry.getKey(), resultOf(entry.getKey(), entry.getValue()));
          it.remove();
        }
      }
      return drained;
    }

    @Override
    public synchronized boolean isComplete() {
      return pending.isEmpty();
    }

    private static ProbeResult resultOf(Backend backend, Future<ProbeResult> future) {
      try {
        ProbeResult result = future.get();
        return result == null ? ProbeResult.DISCONNECTED : result;
      } catch (ExecutionException ex) {
        log.warn("Probe task for {} escaped its own error handling", backend.displayName(), ex.getCause());
        return ProbeResult.DISCONNECTED;
      } catch (CancellationException ex) {
        log.debug("Probe task for {} was cancelled", backend.displayName());
        return ProbeResult.DISCONNECTED;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return ProbeResult.DISCONNECTED;
      }
    }
  }
}
