package io.clusterhive.cluster.credentials;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Jackson binding for the parts of a kubeconfig file this module reads. Users and auth material
 * are left to the client library.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record KubeConfigDocument(
    @JsonProperty("current-context") String currentContext,
    List<NamedCluster> clusters,
    List<NamedContext> contexts
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NamedCluster(String name, Cluster cluster) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Cluster(String server) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NamedContext(String name, Context context) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Context(String cluster, String user, String namespace) {
  }
}
