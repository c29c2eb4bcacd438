package io.clusterhive.tunnel.transport;

/**
 * Opens port forwards to pods.
 */
public interface TunnelTransport {

  /**
   * Blocks until the local listener is bound, then returns the running forward.
   *
   * @throws io.clusterhive.tunnel.TunnelException with reason {@code TRANSPORT_FAILURE} when the
   *     forward cannot be established
   */
  PortForwardHandle open(TunnelEndpoint endpoint);
}
