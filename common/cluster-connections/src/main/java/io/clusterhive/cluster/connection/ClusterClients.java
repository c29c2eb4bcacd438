package io.clusterhive.cluster.connection;

import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.Objects;

/**
 * Typed and dynamic client handles bound to one endpoint. Both views share one underlying HTTP
 * client, so closing the pair closes it once.
 */
public record ClusterClients(KubernetesClient typed, DynamicClusterClient dynamic) implements AutoCloseable {

  public ClusterClients {
    Objects.requireNonNull(typed, "typed");
    Objects.requireNonNull(dynamic, "dynamic");
  }

  public static ClusterClients of(KubernetesClient client) {
    return new ClusterClients(client, new DynamicClusterClient(client));
  }

  public String serverUrl() {
    return typed.getMasterUrl() == null ? null : typed.getMasterUrl().toString();
  }

  @Override
  public void close() {
    typed.close();
  }
}
