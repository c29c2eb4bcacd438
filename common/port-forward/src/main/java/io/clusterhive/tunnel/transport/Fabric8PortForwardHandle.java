package io.clusterhive.tunnel.transport;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.LocalPortForward;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle over a fabric8 {@link LocalPortForward} and the client dedicated to it.
 * <p>
 * fabric8 sets {@link LocalPortForward#errorOccurred()} as soon as a single forwarded connection
 * fails, while the listener keeps accepting new ones. Only a dead listener counts as a failure;
 * connection errors seen before that are logged.
 */
final class Fabric8PortForwardHandle implements PortForwardHandle {

  private static final Logger log = LoggerFactory.getLogger(Fabric8PortForwardHandle.class);

  private final LocalPortForward forward;
  private final KubernetesClient client;
  private int reportedErrors;
  private boolean closed;

  Fabric8PortForwardHandle(LocalPortForward forward, KubernetesClient client) {
    this.forward = forward;
    this.client = client;
  }

  @Override
  public int localPort() {
    return forward.getLocalPort();
  }

  @Override
  public boolean isAlive() {
    return forward.isAlive();
  }

  @Override
  public synchronized Optional<Throwable> failure() {
    List<Throwable> errors = errors();
    if (forward.isAlive()) {
      logConnectionErrors(errors);
      return Optional.empty();
    }
    if (!errors.isEmpty()) {
      return Optional.of(errors.get(0));
    }
    if (forward.errorOccurred()) {
      return Optional.of(new IOException("port forward reported an error"));
    }
    return Optional.of(new IOException("port forward listener on " + forward.getLocalPort() + " stopped"));
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      forward.close();
    } catch (IOException e) {
      log.warn("failed to close port forward on {}", forward.getLocalPort(), e);
    } finally {
      client.close();
    }
  }

  private void logConnectionErrors(List<Throwable> errors) {
    for (int i = reportedErrors; i < errors.size(); i++) {
      Throwable error = errors.get(i);
      log.warn("connection through port forward on {} failed: {}", forward.getLocalPort(), error.getMessage());
      log.debug("connection failure detail", error);
    }
    reportedErrors = Math.max(reportedErrors, errors.size());
  }

  private List<Throwable> errors() {
    List<Throwable> errors = new ArrayList<>();
    addAll(errors, forward.getClientThrowables());
    addAll(errors, forward.getServerThrowables());
    return errors;
  }

  private static void addAll(List<Throwable> target, Collection<Throwable> source) {
    if (source != null) {
      target.addAll(source);
    }
  }
}
