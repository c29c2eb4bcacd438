package io.clusterhive.tunnel.transport;

import io.clusterhive.cluster.context.ConnectionParameters;
import java.util.Objects;

/**
 * Everything a transport needs to open one forward: which credentials to use and which pod port to
 * reach. {@code localPort} 0 binds an ephemeral port.
 */
public record TunnelEndpoint(
    ConnectionParameters connection,
    String namespace,
    String podName,
    int localPort,
    int remotePort) {

  public TunnelEndpoint {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(podName, "podName");
  }
}
