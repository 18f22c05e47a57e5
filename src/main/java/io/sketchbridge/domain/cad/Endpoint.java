package io.sketchbridge.domain.cad;

import io.sketchbridge.validation.Net;
import io.sketchbridge.validation.Numbers;

/**
 * Host and port of a backend's RPC server.
 *
 * @param host hostname or IP literal; validated on construction
 * @param port TCP port in {@code 1..65535}
 * @since 0.1.0
 */
public record Endpoint(String host, int port) {

  /**
   * Validates host and port.
   *
   * @throws IllegalArgumentException if the host is blank or malformed, or the port is out of range
   */
  public Endpoint {
    host = Net.requireHost(host);
    Numbers.requireRange("port", port, 1, 65535);
  }

  @Override
  public String toString() {
    return host.indexOf(':') >= 0 ? '[' + host + "]:" + port : host + ':' + port;
  }
}
