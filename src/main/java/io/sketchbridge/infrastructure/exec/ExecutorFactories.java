package io.sketchbridge.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors behind connection monitoring.
 *
 * <p>All threads are daemons: {@code stop()} on the connection manager does not wait for in-flight probes, and a
 * probe stuck on a dead socket must not keep the JVM alive.</p>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for blocking probe calls.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs and continues
   * @return configured executor service
   */
  public static ExecutorService newProbePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(
        (prefix == null || prefix.isBlank()) ? "sketchbridge-probe" : prefix, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-threaded scheduler that owns probe ticks and result reconciliation.
   *
   * <p>Delayed tasks still queued at shutdown are dropped rather than run.</p>
   *
   * @param name thread name
   * @return configured scheduler
   */
  public static ScheduledExecutorService newControlScheduler(String name) {
    String threadName = (name == null || name.isBlank()) ? "sketchbridge-control" : name;
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, threadName);
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }

  private static ThreadFactory threadFactory(String threadPrefix, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
