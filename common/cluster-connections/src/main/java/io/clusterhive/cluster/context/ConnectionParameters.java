package io.clusterhive.cluster.context;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw connection parameters of a registered context, used by transports that need their own
 * low-level connection instead of the shared client handles.
 *
 * @param contextName registry key of the context
 * @param fileContext name of the context inside the credential file
 * @param kubeconfig  credential file the context was loaded from
 */
public record ConnectionParameters(String contextName, String fileContext, Path kubeconfig) {

  public ConnectionParameters {
    Objects.requireNonNull(contextName, "contextName");
    Objects.requireNonNull(fileContext, "fileContext");
    Objects.requireNonNull(kubeconfig, "kubeconfig");
  }
}
