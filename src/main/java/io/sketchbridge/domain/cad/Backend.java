package io.sketchbridge.domain.cad;

import java.util.List;
import java.util.Locale;

/**
 * <strong>What:</strong> Closed set of CAD systems SketchBridge can reach over RPC.
 * <p><strong>Why:</strong> Gives the connection manager a fixed, enumerable key space so per-backend state can be
 * preallocated and probed independently.</p>
 * <p><strong>Role:</strong> Domain value shared by ports, use cases, configuration, and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum Backend {
  /** FreeCAD via its RPC workbench. */
  FREECAD("FreeCAD", 9876),
  /** Autodesk Inventor via the SketchBridge add-in. */
  INVENTOR("Inventor", 9877),
  /** SolidWorks via the SketchBridge add-in. */
  SOLIDWORKS("SolidWorks", 9878),
  /** Fusion 360 via the SketchBridge add-in. */
  FUSION("Fusion 360", 9879);

  /** Host used by every default endpoint. */
  public static final String DEFAULT_HOST = "localhost";

  private static final List<Backend> ALL = List.of(values());

  private final String displayName;
  private final int defaultPort;

  Backend(String displayName, int defaultPort) {
    this.displayName = displayName;
    this.defaultPort = defaultPort;
  }

  /**
   * Returns the human-readable name shown to operators.
   *
   * @return display name such as {@code "Fusion 360"}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns the RPC port the backend's server listens on when not configured otherwise.
   *
   * @return default TCP port
   */
  public int defaultPort() {
    return defaultPort;
  }

  /**
   * Returns the default connection endpoint ({@code localhost:<defaultPort>}).
   *
   * @return default endpoint
   */
  public Endpoint defaultEndpoint() {
    return new Endpoint(DEFAULT_HOST, defaultPort);
  }

  /**
   * Lower-case configuration key for this backend (e.g., {@code solidworks}).
   *
   * @return configuration key used under {@code backends.<key>.*}
   */
  public String configKey() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns all backends in declaration order.
   *
   * @return immutable list of every backend
   */
  public static List<Backend> all() {
    return ALL;
  }

  /**
   * Resolves a backend from a user-supplied name.
   *
   * <p>Matching is case-insensitive against the enum name and the display name; {@code fusion360} is accepted
   * as an alias for {@link #FUSION}.</p>
   *
   * @param name backend name; must not be {@code null}
   * @return matching backend
   * @throws IllegalArgumentException if the name is not recognised
   */
  public static Backend fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("backend name must not be null");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("fusion360")) {
      return FUSION;
    }
    for (Backend backend : ALL) {
      if (backend.configKey().equals(normalized)
          || backend.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
        return backend;
      }
    }
    throw new IllegalArgumentException("Unknown CAD system: " + name);
  }
}
