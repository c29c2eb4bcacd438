package io.clusterhive.tunnel.transport;

import io.clusterhive.cluster.connection.ConnectionSettings;
import io.clusterhive.tunnel.TunnelException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.LocalPortForward;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TunnelTransport} built on fabric8's websocket port forward.
 * <p>
 * Each forward gets a dedicated client for the context it was started from, so switching the
 * active context afterwards does not affect running tunnels.
 */
public final class Fabric8TunnelTransport implements TunnelTransport {

  private static final Logger log = LoggerFactory.getLogger(Fabric8TunnelTransport.class);

  private final ConnectionSettings settings;

  public Fabric8TunnelTransport() {
    this(ConnectionSettings.defaults());
  }

  public Fabric8TunnelTransport(ConnectionSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public PortForwardHandle open(TunnelEndpoint endpoint) {
    KubernetesClient client = buildClient(endpoint);
    try {
      LocalPortForward forward = client.pods()
          .inNamespace(endpoint.namespace())
          .withName(endpoint.podName())
          .portForward(endpoint.remotePort(), endpoint.localPort());
      log.debug("port forward bound on {} to {}/{}:{}",
          forward.getLocalPort(), endpoint.namespace(), endpoint.podName(), endpoint.remotePort());
      return new Fabric8PortForwardHandle(forward, client);
    } catch (RuntimeException e) {
      client.close();
      throw new TunnelException(TunnelException.Reason.TRANSPORT_FAILURE,
          "failed to forward to pod " + endpoint.podName() + ": " + e.getMessage(), e);
    }
  }

  private KubernetesClient buildClient(TunnelEndpoint endpoint) {
    Config config;
    try {
      String content = Files.readString(endpoint.connection().kubeconfig(), StandardCharsets.UTF_8);
      config = Config.fromKubeconfig(endpoint.connection().fileContext(), content,
          endpoint.connection().kubeconfig().toString());
    } catch (IOException | RuntimeException e) {
      throw new TunnelException(TunnelException.Reason.TRANSPORT_FAILURE,
          "failed to build config for context " + endpoint.connection().contextName() + ": " + e.getMessage(), e);
    }
    config.setConnectionTimeout(toMillis(settings.connectTimeout()));
    config.setRequestTimeout(toMillis(settings.requestTimeout()));
    return new KubernetesClientBuilder().withConfig(config).build();
  }

  private static int toMillis(Duration duration) {
    long millis = duration.toMillis();
    return millis > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) millis;
  }
}
