package io.clusterhive.cluster.connection;

import java.nio.file.Path;

/**
 * Builds client handles for a cluster endpoint and confirms the endpoint answers before the
 * handles are handed out.
 * <p>
 * Implementations must close any client they built when the connectivity probe fails, and must
 * report that failure as {@code CONNECTION_UNREACHABLE}.
 */
public interface ConnectionFactory {

  /**
   * Connect using the current context of the given kubeconfig file.
   *
   * @param kubeconfig absolute path of a readable kubeconfig file
   * @return probed client handles
   */
  ClusterClients connect(Path kubeconfig);

  /**
   * Connect using the service-account configuration mounted into the running pod.
   *
   * @return probed client handles
   */
  ClusterClients connectInCluster();
}
