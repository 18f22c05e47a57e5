package io.sketchbridge.testutil;

import io.sketchbridge.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

public final class RecordingMetrics implements MetricsPort {
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  public long count(String key) {
    AtomicLong counter = counters.get(key);
    return counter == null ? 0L : counter.get();
  }

  public List<Long> observations(String key) {
    return List.copyOf(observations.getOrDefault(key, List.of()));
  }
}
