package io.sketchbridge.application.connection;

import io.sketchbridge.domain.cad.Backend;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> State holder for every backend's {@link ConnectionRecord}.
 * <p><strong>Role:</strong> Owned by {@link ConnectionManager}; other components see its contents only through the
 * manager's query methods, which return immutable snapshots.</p>
 * <p><strong>Thread-safety:</strong> The map is built once and never modified; each record synchronizes itself.</p>
 *
 * @since 0.1.0
 */
final class ConnectionRegistry {
  private final Map<Backend, ConnectionRecord> records;

  ConnectionRegistry() {
    Map<Backend, ConnectionRecord> map = new EnumMap<>(Backend.class);
    for (Backend backend : Backend.all()) {
      map.put(backend, new ConnectionRecord());
    }
    this.records = Collections.unmodifiableMap(map);
  }

  ConnectionRecord record(Backend backend) {
    return records.get(Objects.requireNonNull(backend, "backend"));
  }

  boolean isConnected(Backend backend) {
    return record(backend).connected();
  }

  Map<String, Object> status(Backend backend) {
    return record(backend).status();
  }
}
