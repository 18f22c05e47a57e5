package io.sketchbridge.application.port;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.Endpoint;

/**
 * <strong>What:</strong> Service-provider contract that builds the RPC adapter for one backend.
 * <p><strong>Why:</strong> Backend adapters carry heavyweight client libraries; they are discovered at runtime via
 * {@link java.util.ServiceLoader} and only instantiated on first real use.</p>
 * <p><strong>Registration:</strong> list implementations in
 * {@code META-INF/services/io.sketchbridge.application.port.CadClientFactory}.</p>
 *
 * @since 0.1.0
 */
public interface CadClientFactory {

  /**
   * Backend this factory serves.
   *
   * @return backend key
   */
  Backend backend();

  /**
   * Creates an adapter bound to the given endpoint. Called at most once per manager.
   *
   * @param endpoint RPC server location
   * @return new, not yet connected adapter
   */
  CadClientPort create(Endpoint endpoint);
}
