package io.sketchbridge.api;

import io.sketchbridge.domain.cad.Backend;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Parses a comma-separated backend list.
   *
   * @param raw list such as {@code freecad,fusion360}; blank or {@code all} selects every backend
   * @return backends in the order given, without duplicates
   * @throws IllegalArgumentException for unknown backend names
   */
  static List<Backend> parseBackends(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("all")) {
      return Backend.all();
    }
    List<Backend> selected = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      Backend backend = Backend.fromName(token.trim());
      if (!selected.contains(backend)) {
        selected.add(backend);
      }
    }
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("backends must name at least one backend");
    }
    return List.copyOf(selected);
  }
}
