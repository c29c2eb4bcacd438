package io.clusterhive.cluster.context;

/**
 * Point-in-time copy of one registered context. Changing the registry afterwards does not affect
 * an instance that was already handed out.
 *
 * @param name       registry key
 * @param cluster    cluster id from the credential file
 * @param user       user id from the credential file
 * @param namespace  default namespace of the context
 * @param serverUrl  API server URL
 * @param configPath credential file the context was loaded from, {@code null} for in-cluster contexts
 * @param active     whether this is the active context
 */
public record ContextInfo(
    String name,
    String cluster,
    String user,
    String namespace,
    String serverUrl,
    String configPath,
    boolean active
) {
}
