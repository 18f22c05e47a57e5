package io.sketchbridge.infrastructure.client;

import io.sketchbridge.application.port.CadClientFactory;
import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.Endpoint;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the per-backend adapter table from registered {@link CadClientFactory} providers.
 *
 * <p>Backends with a provider get a {@link LazyCadClient} around it; the rest get a {@link DisabledCadClient}.
 * When two providers claim the same backend the first one found wins.</p>
 */
public final class CadClients {
  private static final Logger log = LoggerFactory.getLogger(CadClients.class);

  private CadClients() {}

  /**
   * Discovers providers on the context class path.
   *
   * @param endpoints endpoint per backend; backends missing here use their default endpoint
   * @return adapter for every backend
   */
  public static Map<Backend, CadClientPort> discover(Map<Backend, Endpoint> endpoints) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = CadClients.class.getClassLoader();
    }
    return fromFactories(ServiceLoader.load(CadClientFactory.class, loader), endpoints);
  }

  /**
   * Builds the table from an explicit set of providers.
   *
   * @param factories providers in priority order
   * @param endpoints endpoint per backend; backends missing here use their default endpoint
   * @return adapter for every backend
   */
  public static Map<Backend, CadClientPort> fromFactories(
      Iterable<? extends CadClientFactory> factories, Map<Backend, Endpoint> endpoints) {
    Objects.requireNonNull(factories, "factories");
    Objects.requireNonNull(endpoints, "endpoints");
    Map<Backend, CadClientFactory> byBackend = new EnumMap<>(Backend.class);
    for (CadClientFactory factory : factories) {
      CadClientFactory existing = byBackend.putIfAbsent(factory.backend(), factory);
      if (existing != null) {
        log.warn("Ignoring {} for {}; {} already registered",
            factory.getClass().getName(), factory.backend().displayName(), existing.getClass().getName());
      }
    }

    Map<Backend, CadClientPort> clients = new EnumMap<>(Backend.class);
    for (Backend backend : Backend.all()) {
      Endpoint endpoint = endpoints.getOrDefault(backend, backend.defaultEndpoint());
      CadClientFactory factory = byBackend.get(backend);
      if (factory == null) {
        clients.put(backend, new DisabledCadClient(backend, "no adapter registered for " + endpoint));
      } else {
        log.debug("Using {} for {} at {}", factory.getClass().getName(), backend.displayName(), endpoint);
        clients.put(backend, new LazyCadClient(backend, () -> factory.create(endpoint)));
      }
    }
    return Collections.unmodifiableMap(clients);
  }
}
