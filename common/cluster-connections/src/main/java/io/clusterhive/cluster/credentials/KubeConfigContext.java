package io.clusterhive.cluster.credentials;

/**
 * One context entry of a kubeconfig file, joined with the server of the cluster it references.
 */
public record KubeConfigContext(
    String name,
    String cluster,
    String user,
    String namespace,
    String serverUrl
) {
}
