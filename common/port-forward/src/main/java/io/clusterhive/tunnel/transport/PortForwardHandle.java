package io.clusterhive.tunnel.transport;

import java.util.Optional;

/**
 * A bound, running forward.
 */
public interface PortForwardHandle extends AutoCloseable {

  int localPort();

  boolean isAlive();

  /**
   * The error that brought the listener down, if any. Errors on individual forwarded connections
   * are not reported here while the listener keeps accepting.
   */
  Optional<Throwable> failure();

  /**
   * Stops accepting connections and releases the transport. Safe to call more than once.
   */
  @Override
  void close();
}
