package io.clusterhive.cluster.connection;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import java.util.Objects;

/**
 * Schema-agnostic view of a cluster endpoint. Resources are addressed by api version and kind and
 * handled as {@link GenericKubernetesResource} maps rather than typed models.
 */
public final class DynamicClusterClient {

  private final KubernetesClient client;

  public DynamicClusterClient(KubernetesClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>>
      resources(String apiVersion, String kind) {
    return client.genericKubernetesResources(apiVersion, kind);
  }

  public MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>>
      resources(ResourceDefinitionContext definition) {
    return client.genericKubernetesResources(definition);
  }

  public String masterUrl() {
    return client.getMasterUrl() == null ? null : client.getMasterUrl().toString();
  }
}
